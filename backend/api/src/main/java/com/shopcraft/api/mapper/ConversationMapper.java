package com.shopcraft.api.mapper;

import com.shopcraft.api.entity.Conversation;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;
import java.util.Optional;

/**
 * Conversation Mapper Interface
 */
@Mapper
public interface ConversationMapper {

    /**
     * 대화 세션 생성
     */
    void insert(Conversation conversation);

    /**
     * 대화 ID로 조회
     */
    Optional<Conversation> findById(String conversationId);

    /**
     * 클라이언트(title)의 대화 중 메시지가 있는 것만 최신순 조회
     */
    List<Conversation> findWithMessagesByTitle(String title);
}
