package com.shopcraft.api.controller;

import com.shopcraft.api.dto.ChatDto;
import com.shopcraft.api.service.ChatService;
import com.shopcraft.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/chat")
@Tag(name = "Chat", description = "소재 생성 채팅 API")
public class ChatController {

    static final String CLIENT_ID_HEADER = "X-Client-Id";

    private final ChatService chatService;

    @PostMapping
    @Operation(summary = "메시지 전송", description = "상품 설명(+이미지)으로 전자상거래 소재를 생성하고 대화에 저장합니다.")
    public ApiResponse<ChatDto.ChatResponse> sendMessage(
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId,
            @RequestBody ChatDto.MessageRequest request) {
        ChatDto.ChatResponse response = chatService.sendMessage(clientId, request);
        log.info("[Chat] Asset generated - conversationId: {}, stage: {}", response.getConversationId(), response.getStage());
        return ApiResponse.success(response);
    }

    @GetMapping
    @Operation(summary = "메시지 목록", description = "대화의 메시지를 시간순으로 조회합니다.")
    public ApiResponse<List<ChatDto.Message>> getMessages(
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId,
            @RequestParam String conversationId) {
        return ApiResponse.success(chatService.listMessages(clientId, conversationId));
    }
}
