package com.shopcraft.api.controller;

import com.shopcraft.api.dto.ConversationDto;
import com.shopcraft.api.service.ChatService;
import com.shopcraft.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/conversations")
@Tag(name = "Conversation", description = "대화 목록 API")
public class ConversationController {

    private final ChatService chatService;

    @GetMapping
    @Operation(summary = "대화 목록", description = "클라이언트 소유 대화 중 메시지가 있는 대화를 최신순으로 조회합니다.")
    public ApiResponse<List<ConversationDto.Summary>> getConversations(
            @RequestHeader(value = ChatController.CLIENT_ID_HEADER, required = false) String clientId) {
        return ApiResponse.success(chatService.listConversations(clientId));
    }

    @PostMapping
    @Operation(summary = "대화 생성")
    public ApiResponse<ConversationDto.Summary> createConversation(
            @RequestBody(required = false) ConversationDto.CreateRequest request) {
        return ApiResponse.success(chatService.createConversation(request != null ? request.getTitle() : null));
    }
}
