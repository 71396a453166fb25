package com.shopcraft.api.dto;

import com.shopcraft.api.service.generation.GenerationStage;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 채팅(소재 생성) API DTO
 */
public class ChatDto {

    /**
     * 메시지 전송 요청
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageRequest {
        private String conversationId;  // 없으면 새 대화 생성
        private String text;            // 상품 설명 (필수)
        private String title;           // 대화 제목 (클라이언트 ID 헤더가 없을 때 소유자 식별에 사용)
        private String imageUrl;        // 업로드 협력자가 넘겨준 상품 이미지 참조 (옵션)
        private String model;           // 텍스트 모델 오버라이드 (옵션)
    }

    /**
     * 메시지 전송 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChatResponse {
        private String conversationId;
        private Message message;          // 저장된 assistant 메시지
        private AssetDto.Asset asset;     // 생성된 소재 (message.content 와 동일한 내용)
        private GenerationStage stage;    // 소재를 만든 단계 (FULL_CONTEXT / MINIMAL_CONTEXT / MOCK)
    }

    /**
     * 메시지
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String id;
        private String conversationId;
        private String role;         // "user" or "assistant"
        private String content;
        private String messageType;  // text, image_upload, generated_assets
        private String metadata;     // JSON 메타데이터 (이미지 참조, 소재 등)
        private LocalDateTime createdAt;
    }
}
