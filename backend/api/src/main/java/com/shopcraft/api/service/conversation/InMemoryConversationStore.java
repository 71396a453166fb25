package com.shopcraft.api.service.conversation;

import com.shopcraft.api.entity.Conversation;
import com.shopcraft.api.entity.ConversationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리 기반 대화 저장소 (기본값)
 * 프로세스 재시작 시 대화가 사라짐
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "shopcraft.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, List<ConversationMessage>> messages = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConversationStore() {
        this(Clock.systemDefaultZone());
    }

    InMemoryConversationStore(Clock clock) {
        this.clock = clock;
        log.info("InMemoryConversationStore initialized");
    }

    @Override
    public Conversation createConversation(String title) {
        return create(UUID.randomUUID().toString(), title);
    }

    @Override
    public Conversation ensureConversation(String conversationId, String title) {
        if (conversationId != null) {
            Conversation existing = conversations.get(conversationId);
            if (existing != null) {
                return existing;
            }
            return create(conversationId, title);
        }
        return createConversation(title);
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public List<Conversation> listConversationsWithMessages(String clientId) {
        return conversations.values().stream()
                .filter(c -> Objects.equals(c.getTitle(), clientId))
                .filter(c -> !listMessages(c.getConversationId()).isEmpty())
                .sorted(Comparator.comparing(Conversation::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public ConversationMessage appendMessage(ConversationMessage message) {
        if (!conversations.containsKey(message.getConversationId())) {
            throw new IllegalArgumentException("Unknown conversation: " + message.getConversationId());
        }
        ConversationMessage stored = message.toBuilder()
                .messageId(UUID.randomUUID().toString())
                .createdAt(LocalDateTime.now(clock))
                .build();
        List<ConversationMessage> list = messages.computeIfAbsent(message.getConversationId(), k -> new ArrayList<>());
        synchronized (list) {
            list.add(stored);
        }
        return stored;
    }

    @Override
    public List<ConversationMessage> listMessages(String conversationId) {
        List<ConversationMessage> list = messages.get(conversationId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    private Conversation create(String conversationId, String title) {
        Conversation conversation = Conversation.builder()
                .conversationId(conversationId)
                .title(title)
                .createdAt(LocalDateTime.now(clock))
                .build();
        Conversation previous = conversations.putIfAbsent(conversationId, conversation);
        return previous != null ? previous : conversation;
    }
}
