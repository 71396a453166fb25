package com.shopcraft.api.service.image;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 원격 대표 이미지 합성 요청
 */
@Getter
@ToString
public final class CompositionRequest {

    public static final String DEFAULT_SIZE = "2K";

    private final String sourceImageRef;
    private final String instructionText;
    private final String sizeTag;

    public CompositionRequest(String sourceImageRef, String instructionText, String sizeTag) {
        this.sourceImageRef = Objects.requireNonNull(sourceImageRef, "sourceImageRef");
        this.instructionText = Objects.requireNonNull(instructionText, "instructionText");
        this.sizeTag = sizeTag == null || sizeTag.isBlank() ? DEFAULT_SIZE : sizeTag.trim();
    }
}
