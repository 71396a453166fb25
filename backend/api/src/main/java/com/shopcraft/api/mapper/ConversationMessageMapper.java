package com.shopcraft.api.mapper;

import com.shopcraft.api.entity.ConversationMessage;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

/**
 * ConversationMessage Mapper Interface
 */
@Mapper
public interface ConversationMessageMapper {

    /**
     * 메시지 추가
     */
    void insert(ConversationMessage message);

    /**
     * 대화 ID로 메시지 목록 조회 (시간순 정렬)
     */
    List<ConversationMessage> findByConversationId(String conversationId);
}
