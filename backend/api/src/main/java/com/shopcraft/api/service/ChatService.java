package com.shopcraft.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcraft.api.dto.ChatDto;
import com.shopcraft.api.dto.ConversationDto;
import com.shopcraft.api.entity.Conversation;
import com.shopcraft.api.entity.ConversationMessage;
import com.shopcraft.api.service.conversation.ConversationStore;
import com.shopcraft.api.service.generation.AssetGenerationService;
import com.shopcraft.api.service.generation.ChatTurn;
import com.shopcraft.api.service.generation.GeneratedAsset;
import com.shopcraft.api.service.generation.GenerationRequest;
import com.shopcraft.api.service.generation.TurnRole;
import com.shopcraft.api.util.ImageRefValidator;
import com.shopcraft.common.exception.ApiException;
import com.shopcraft.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 소재 생성 대화 서비스
 * 대화 저장소와 소재 생성 파이프라인 연결, 클라이언트별 대화 격리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final ConversationStore conversationStore;
    private final AssetGenerationService assetGenerationService;
    private final ObjectMapper objectMapper;

    /**
     * 메시지 전송 → 소재 생성 → assistant 메시지 저장
     * @param clientIdHeader X-Client-Id 헤더 (nullable, 없으면 request.title 로 소유자 판별)
     */
    public ChatDto.ChatResponse sendMessage(String clientIdHeader, ChatDto.MessageRequest request) {
        String text = request.getText();
        if (text == null || text.isBlank()) {
            throw new ApiException(ErrorCode.MESSAGE_EMPTY);
        }
        String imageUrl = request.getImageUrl();
        if (imageUrl != null && !imageUrl.isBlank()) {
            ImageRefValidator.validateOrThrow(imageUrl, "imageUrl");
        } else {
            imageUrl = null;
        }

        String clientId = firstNonBlank(clientIdHeader, request.getTitle());
        if (request.getConversationId() != null) {
            checkAccess(request.getConversationId(), clientId);
        }
        Conversation conversation = conversationStore.ensureConversation(
                request.getConversationId(), clientId != null ? clientId : request.getTitle());
        String conversationId = conversation.getConversationId();

        log.info("[Chat] Message - conversationId: {}, textLength: {}, hasImage: {}",
                conversationId, text.length(), imageUrl != null);

        // 이력은 현재 메시지 저장 전에 조회 (현재 설명이 이력에 중복되지 않도록)
        List<ChatTurn> history = conversationStore.listMessages(conversationId).stream()
                .map(m -> ChatTurn.of(TurnRole.fromValue(m.getRole()), m.getContent()))
                .toList();

        conversationStore.appendMessage(ConversationMessage.builder()
                .conversationId(conversationId)
                .role(TurnRole.USER.getValue())
                .content(text)
                .messageType(imageUrl != null ? ConversationMessage.TYPE_IMAGE_UPLOAD : ConversationMessage.TYPE_TEXT)
                .metadata(imageUrl != null ? toJson(Map.of("imageUrl", imageUrl)) : null)
                .build());

        GeneratedAsset generated = assetGenerationService.generate(
                new GenerationRequest(text, history, imageUrl, request.getModel()));

        String assetJson = toJson(generated.getAsset());
        ConversationMessage saved = conversationStore.appendMessage(ConversationMessage.builder()
                .conversationId(conversationId)
                .role(TurnRole.ASSISTANT.getValue())
                .content(assetJson)
                .messageType(ConversationMessage.TYPE_GENERATED_ASSETS)
                .metadata(assetJson)
                .build());

        return ChatDto.ChatResponse.builder()
                .conversationId(conversationId)
                .message(toDto(saved))
                .asset(generated.getAsset())
                .stage(generated.getStage())
                .build();
    }

    /**
     * 대화 메시지 목록 (헤더가 있으면 소유자 확인)
     */
    public List<ChatDto.Message> listMessages(String clientIdHeader, String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "conversationId is required");
        }
        String clientId = firstNonBlank(clientIdHeader, null);
        if (clientId != null) {
            checkAccess(conversationId, clientId);
        }
        return conversationStore.listMessages(conversationId).stream()
                .map(this::toDto)
                .toList();
    }

    /**
     * 클라이언트 소유 대화 중 메시지가 있는 대화 (헤더가 없으면 빈 목록)
     */
    public List<ConversationDto.Summary> listConversations(String clientIdHeader) {
        String clientId = firstNonBlank(clientIdHeader, null);
        if (clientId == null) {
            return List.of();
        }
        return conversationStore.listConversationsWithMessages(clientId).stream()
                .map(ChatService::toSummary)
                .toList();
    }

    public ConversationDto.Summary createConversation(String title) {
        String normalized = title == null || title.isBlank() ? null : title.trim();
        Conversation conversation = conversationStore.createConversation(normalized);
        log.info("[Chat] Conversation created - id: {}", conversation.getConversationId());
        return toSummary(conversation);
    }

    private void checkAccess(String conversationId, String clientId) {
        Conversation existing = conversationStore.findConversation(conversationId).orElse(null);
        if (existing == null || (clientId != null && !Objects.equals(existing.getTitle(), clientId))) {
            log.warn("[Chat] Access denied - conversationId: {}", conversationId);
            throw new ApiException(ErrorCode.CONVERSATION_FORBIDDEN);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.INTERNAL_SERVER_ERROR, "JSON serialization failed", e);
        }
    }

    private ChatDto.Message toDto(ConversationMessage message) {
        return ChatDto.Message.builder()
                .id(message.getMessageId())
                .conversationId(message.getConversationId())
                .role(message.getRole())
                .content(message.getContent())
                .messageType(message.getMessageType())
                .metadata(message.getMetadata())
                .createdAt(message.getCreatedAt())
                .build();
    }

    private static ConversationDto.Summary toSummary(Conversation conversation) {
        return ConversationDto.Summary.builder()
                .id(conversation.getConversationId())
                .title(conversation.getTitle())
                .createdAt(conversation.getCreatedAt())
                .build();
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return null;
    }
}
