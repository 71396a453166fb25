package com.shopcraft.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 소재 생성 대화 세션 엔티티
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {
    private String conversationId;
    private String title;          // 클라이언트 ID 또는 상품명 (소유자 격리에 사용)
    private LocalDateTime createdAt;
}
