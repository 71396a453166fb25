package com.shopcraft.api.service;

import com.shopcraft.api.config.HttpClientConfig;
import com.shopcraft.api.dto.ChatDto;
import com.shopcraft.api.entity.ConversationMessage;
import com.shopcraft.api.service.conversation.InMemoryConversationStore;
import com.shopcraft.api.service.generation.AssetGenerationService;
import com.shopcraft.api.service.generation.GeneratedAsset;
import com.shopcraft.api.service.generation.GenerationRequest;
import com.shopcraft.api.service.generation.GenerationStage;
import com.shopcraft.api.service.generation.MockAssetFactory;
import com.shopcraft.api.service.generation.TurnRole;
import com.shopcraft.common.exception.ApiException;
import com.shopcraft.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatServiceTest {

    @Mock
    private AssetGenerationService assetGenerationService;

    private InMemoryConversationStore store;
    private ChatService chatService;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore();
        chatService = new ChatService(store, assetGenerationService, new HttpClientConfig().objectMapper());
    }

    @Test
    void sendMessageStoresUserAndAssistantMessages() {
        stubGeneration();

        ChatDto.ChatResponse response = chatService.sendMessage("client-a", ChatDto.MessageRequest.builder()
                .text("优质蓝牙耳机带降噪功能")
                .imageUrl("https://cdn.example.com/p.png")
                .build());

        List<ConversationMessage> messages = store.listMessages(response.getConversationId());
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).getMessageType()).isEqualTo(ConversationMessage.TYPE_IMAGE_UPLOAD);
        assertThat(messages.get(0).getMetadata()).isEqualTo("{\"imageUrl\":\"https://cdn.example.com/p.png\"}");
        assertThat(messages.get(1).getMessageType()).isEqualTo(ConversationMessage.TYPE_GENERATED_ASSETS);
        assertThat(messages.get(1).getContent()).contains("\"selling_points\"", "\"video_script\"");
        assertThat(response.getMessage().getRole()).isEqualTo("assistant");
        assertThat(response.getStage()).isEqualTo(GenerationStage.MOCK);
        assertThat(store.findConversation(response.getConversationId()).orElseThrow().getTitle()).isEqualTo("client-a");
    }

    @Test
    void historyExcludesCurrentMessage() {
        stubGeneration();
        String conversationId = chatService.sendMessage("client-a",
                ChatDto.MessageRequest.builder().text("第一次").build()).getConversationId();

        chatService.sendMessage("client-a", ChatDto.MessageRequest.builder()
                .conversationId(conversationId).text("第二次").model("custom-model").build());

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(assetGenerationService, times(2)).generate(captor.capture());
        GenerationRequest second = captor.getAllValues().get(1);
        assertThat(second.getDescription()).isEqualTo("第二次");
        assertThat(second.getModelOverride()).isEqualTo("custom-model");
        assertThat(second.getHistory()).hasSize(2);
        assertThat(second.getHistory().get(0).getRole()).isEqualTo(TurnRole.USER);
        assertThat(second.getHistory().get(0).getContent()).isEqualTo("第一次");
        assertThat(second.getHistory().get(1).getRole()).isEqualTo(TurnRole.ASSISTANT);
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> chatService.sendMessage("client-a", ChatDto.MessageRequest.builder().text("  ").build()))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.MESSAGE_EMPTY);
        verifyNoInteractions(assetGenerationService);
    }

    @Test
    void otherClientsConversationIsForbidden() {
        String conversationId = store.createConversation("client-a").getConversationId();

        assertThatThrownBy(() -> chatService.sendMessage("client-b", ChatDto.MessageRequest.builder()
                .conversationId(conversationId).text("hi").build()))
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONVERSATION_FORBIDDEN);
        assertThatThrownBy(() -> chatService.listMessages("client-b", conversationId))
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONVERSATION_FORBIDDEN);
    }

    @Test
    void unknownConversationIdIsForbidden() {
        assertThatThrownBy(() -> chatService.sendMessage(null, ChatDto.MessageRequest.builder()
                .conversationId("missing").text("hi").build()))
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONVERSATION_FORBIDDEN);
    }

    @Test
    void titleActsAsClientIdWithoutHeader() {
        stubGeneration();

        ChatDto.ChatResponse response = chatService.sendMessage(null,
                ChatDto.MessageRequest.builder().text("围巾").title("shop-1").build());

        assertThat(chatService.listConversations("shop-1"))
                .extracting(s -> s.getId())
                .containsExactly(response.getConversationId());
    }

    @Test
    void invalidImageReferenceIsRejected() {
        assertThatThrownBy(() -> chatService.sendMessage("client-a", ChatDto.MessageRequest.builder()
                .text("hi").imageUrl("ERROR: upload failed").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void conversationsWithoutClientIdAreEmpty() {
        store.createConversation("client-a");

        assertThat(chatService.listConversations(null)).isEmpty();
        assertThat(chatService.listConversations("client-a")).isEmpty();
    }

    @Test
    void listMessagesRequiresConversationId() {
        assertThatThrownBy(() -> chatService.listMessages(null, " "))
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_REQUEST);
    }

    private void stubGeneration() {
        when(assetGenerationService.generate(any())).thenAnswer(invocation -> {
            GenerationRequest request = invocation.getArgument(0);
            return new GeneratedAsset(new MockAssetFactory().create(request.getDescription()), GenerationStage.MOCK);
        });
    }
}
