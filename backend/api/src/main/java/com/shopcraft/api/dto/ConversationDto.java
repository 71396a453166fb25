package com.shopcraft.api.dto;

import lombok.*;

import java.time.LocalDateTime;

public class ConversationDto {

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        private String title;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private String id;
        private String title;
        private LocalDateTime createdAt;
    }
}
