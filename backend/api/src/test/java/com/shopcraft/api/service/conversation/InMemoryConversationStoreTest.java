package com.shopcraft.api.service.conversation;

import com.shopcraft.api.entity.Conversation;
import com.shopcraft.api.entity.ConversationMessage;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryConversationStoreTest {

    private final InMemoryConversationStore store = new InMemoryConversationStore();

    @Test
    void ensureConversationReusesExistingAndCreatesWithGivenId() {
        Conversation created = store.ensureConversation("conv-1", "client-a");
        Conversation again = store.ensureConversation("conv-1", "other");
        Conversation fresh = store.ensureConversation(null, "client-a");

        assertThat(again).isSameAs(created);
        assertThat(again.getTitle()).isEqualTo("client-a");
        assertThat(fresh.getConversationId()).isNotEqualTo("conv-1");
    }

    @Test
    void messagesAreListedInAppendOrderWithAssignedIds() {
        Conversation conversation = store.createConversation("client-a");
        store.appendMessage(message(conversation, "user", "第一条"));
        store.appendMessage(message(conversation, "assistant", "第二条"));

        List<ConversationMessage> messages = store.listMessages(conversation.getConversationId());

        assertThat(messages).extracting(ConversationMessage::getContent).containsExactly("第一条", "第二条");
        assertThat(messages).allSatisfy(m -> {
            assertThat(m.getMessageId()).isNotBlank();
            assertThat(m.getCreatedAt()).isNotNull();
        });
    }

    @Test
    void appendToUnknownConversationFails() {
        assertThatThrownBy(() -> store.appendMessage(ConversationMessage.builder()
                .conversationId("missing").role("user").content("x").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listsOnlyOwnedConversationsWithMessagesNewestFirst() {
        MutableClock clock = new MutableClock();
        InMemoryConversationStore timed = new InMemoryConversationStore(clock);
        Conversation older = timed.createConversation("client-a");
        clock.advance();
        Conversation newer = timed.createConversation("client-a");
        clock.advance();
        timed.createConversation("client-a");
        Conversation foreign = timed.createConversation("client-b");
        timed.appendMessage(message(older, "user", "a"));
        timed.appendMessage(message(newer, "user", "b"));
        timed.appendMessage(message(foreign, "user", "c"));

        List<Conversation> result = timed.listConversationsWithMessages("client-a");

        assertThat(result).extracting(Conversation::getConversationId)
                .containsExactly(newer.getConversationId(), older.getConversationId());
    }

    @Test
    void unknownConversationHasNoMessages() {
        assertThat(store.listMessages("nope")).isEmpty();
        assertThat(store.findConversation("nope")).isEmpty();
        assertThat(store.findConversation(null)).isEmpty();
    }

    private static ConversationMessage message(Conversation conversation, String role, String content) {
        return ConversationMessage.builder()
                .conversationId(conversation.getConversationId())
                .role(role)
                .content(content)
                .messageType(ConversationMessage.TYPE_TEXT)
                .build();
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance() {
            now = now.plus(Duration.ofMinutes(1));
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
