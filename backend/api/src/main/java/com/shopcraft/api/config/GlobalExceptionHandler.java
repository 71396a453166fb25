package com.shopcraft.api.config;

import com.shopcraft.common.dto.ApiResponse;
import com.shopcraft.common.exception.ApiException;
import com.shopcraft.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.UUID;

/**
 * 전역 예외 처리기
 * - 모든 예외를 ApiResponse 형식으로 변환
 * - 요청 ID 를 로그와 응답 메시지에 함께 남겨 추적 가능하게 함
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[{}] API exception {} ({}) at {}: {}",
                    requestId, errorCode.getCode(), errorCode.name(), request.getDescription(false), e.getMessage(), e);
        } else {
            log.warn("[{}] API exception {} ({}) at {}: {}",
                    requestId, errorCode.getCode(), errorCode.name(), request.getDescription(false), e.getMessage());
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, e.getMessage(), requestId)));
    }

    /**
     * 요청 형식 오류 (본문 파싱 실패, 필수 파라미터/헤더 누락, 잘못된 인자)
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] Bad request at {}: {}", requestId, request.getDescription(false), e.getMessage());

        ErrorCode errorCode = ErrorCode.INVALID_REQUEST;
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, null, requestId)));
    }

    /**
     * 일반 Exception 처리 - 예상치 못한 예외
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();
        log.error("[{}] Unexpected {} at {}: {}",
                requestId, e.getClass().getName(), request.getDescription(false), e.getMessage(), e);

        String userMessage = String.format(
                "서버 오류가 발생했습니다. [요청 ID: %s] 문제가 지속되면 관리자에게 문의해주세요.",
                requestId
        );

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR, userMessage));
    }

    /**
     * 요청 ID 생성 (오류 추적용)
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private String buildUserMessage(ErrorCode errorCode, String message, String requestId) {
        if (message != null && !message.equals(errorCode.getMessage())) {
            return String.format("%s [%s]", message, requestId);
        }
        return String.format("%s [%s]", errorCode.getMessage(), requestId);
    }
}
