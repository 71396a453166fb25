package com.shopcraft.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),

    // Conversation
    CONVERSATION_FORBIDDEN(HttpStatus.FORBIDDEN, "CV003", "해당 대화에 접근할 권한이 없습니다."),
    MESSAGE_EMPTY(HttpStatus.BAD_REQUEST, "CV006", "메시지 내용이 비어 있습니다."),

    // Hero image
    HERO_IMAGE_SOURCE_UNREADABLE(HttpStatus.UNPROCESSABLE_ENTITY, "H001", "원본 상품 이미지를 불러올 수 없어 대표 이미지를 만들 수 없습니다."),
    HERO_IMAGE_ENCODING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "H002", "대표 이미지 인코딩에 실패했습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
