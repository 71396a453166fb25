package com.shopcraft.api.service.conversation;

import com.shopcraft.api.entity.Conversation;
import com.shopcraft.api.entity.ConversationMessage;
import com.shopcraft.api.mapper.ConversationMapper;
import com.shopcraft.api.mapper.ConversationMessageMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 관계형 DB 기반 대화 저장소 (MyBatis)
 * shopcraft.store.type=mybatis 일 때 활성
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "shopcraft.store.type", havingValue = "mybatis")
public class MyBatisConversationStore implements ConversationStore {

    private final ConversationMapper conversationMapper;
    private final ConversationMessageMapper messageMapper;

    @Override
    public Conversation createConversation(String title) {
        return insert(UUID.randomUUID().toString(), title);
    }

    @Override
    @Transactional
    public Conversation ensureConversation(String conversationId, String title) {
        if (conversationId != null) {
            Optional<Conversation> existing = conversationMapper.findById(conversationId);
            if (existing.isPresent()) {
                return existing.get();
            }
            return insert(conversationId, title);
        }
        return createConversation(title);
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return conversationMapper.findById(conversationId);
    }

    @Override
    public List<Conversation> listConversationsWithMessages(String clientId) {
        return conversationMapper.findWithMessagesByTitle(clientId);
    }

    @Override
    public ConversationMessage appendMessage(ConversationMessage message) {
        ConversationMessage stored = message.toBuilder()
                .messageId(UUID.randomUUID().toString())
                .createdAt(LocalDateTime.now())
                .build();
        messageMapper.insert(stored);
        log.debug("Message saved - conversationId: {}, role: {}, type: {}",
                stored.getConversationId(), stored.getRole(), stored.getMessageType());
        return stored;
    }

    @Override
    public List<ConversationMessage> listMessages(String conversationId) {
        return messageMapper.findByConversationId(conversationId);
    }

    private Conversation insert(String conversationId, String title) {
        Conversation conversation = Conversation.builder()
                .conversationId(conversationId)
                .title(title)
                .createdAt(LocalDateTime.now())
                .build();
        conversationMapper.insert(conversation);
        log.info("Conversation created - id: {}", conversationId);
        return conversation;
    }
}
