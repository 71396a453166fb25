package com.shopcraft.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 대화 메시지 엔티티
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE_UPLOAD = "image_upload";
    public static final String TYPE_GENERATED_ASSETS = "generated_assets";

    private String messageId;
    private String conversationId;

    // 메시지 내용
    private String role;  // "user", "assistant"
    private String content;

    // 메시지 유형: text, image_upload, generated_assets
    private String messageType;

    // 메타데이터 (JSON)
    private String metadata;

    private LocalDateTime createdAt;
}
