package com.shopcraft.api.service.conversation;

import com.shopcraft.api.entity.Conversation;
import com.shopcraft.api.entity.ConversationMessage;

import java.util.List;
import java.util.Optional;

/**
 * 대화/메시지 저장소
 * 메모리 구현과 MyBatis(관계형 DB) 구현을 교체 가능 (shopcraft.store.type)
 * 소재 생성 파이프라인은 어떤 구현이 활성인지 알지 못함
 */
public interface ConversationStore {

    /**
     * 새 대화 생성
     * @param title 클라이언트 ID 또는 상품명 (nullable)
     */
    Conversation createConversation(String title);

    /**
     * 대화 보장 - 주어진 ID 의 대화가 있으면 반환, 없으면 해당 ID(없으면 새 ID)로 생성
     */
    Conversation ensureConversation(String conversationId, String title);

    Optional<Conversation> findConversation(String conversationId);

    /**
     * 클라이언트 소유 대화 중 메시지가 하나 이상 있는 대화 (최신순)
     */
    List<Conversation> listConversationsWithMessages(String clientId);

    /**
     * 메시지 추가 - ID 와 생성 시각은 저장소가 부여
     * @return 저장된 메시지
     */
    ConversationMessage appendMessage(ConversationMessage message);

    /**
     * 대화의 메시지 목록 (시간순)
     */
    List<ConversationMessage> listMessages(String conversationId);
}
