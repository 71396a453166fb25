package com.shopcraft.api.service.generation;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 사용자 메시지 1건에 대한 소재 생성 요청 (파이프라인 실행 동안 불변)
 */
@Getter
@ToString
public final class GenerationRequest {

    private final String description;
    private final List<ChatTurn> history;
    private final String imageRef;
    private final String modelOverride;

    public GenerationRequest(String description, List<ChatTurn> history, String imageRef, String modelOverride) {
        this.description = description != null ? description : "";
        this.history = history != null ? List.copyOf(history) : List.of();
        this.imageRef = imageRef == null || imageRef.isBlank() ? null : imageRef;
        this.modelOverride = modelOverride == null || modelOverride.isBlank() ? null : modelOverride.trim();
    }

    public static GenerationRequest of(String description) {
        return new GenerationRequest(description, List.of(), null, null);
    }
}
