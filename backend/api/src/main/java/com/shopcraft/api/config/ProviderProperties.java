package com.shopcraft.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 생성형 AI 프로바이더(Doubao / 火山方舟) 설정
 * - 기동 시 한 번 바인딩되는 불변 값, 각 클라이언트에 주입
 * - 키/엔드포인트가 비어 있으면 "기능 비활성" 상태 (기동 오류 아님 → mock/로컬 폴백으로 동작)
 */
@ConfigurationProperties(prefix = "shopcraft.provider")
public record ProviderProperties(
        String apiKey,
        String textEndpoint,
        String imageEndpoint,
        String textModel,
        String imageModel,
        Integer maxCompletionTokens,
        Duration connectTimeout,
        Duration readTimeout
) {

    public static final String DEFAULT_TEXT_MODEL = "doubao-seed-1-6-251015";
    public static final String DEFAULT_IMAGE_MODEL = "doubao-seedream-4-5-251128";
    public static final String DEFAULT_IMAGE_ENDPOINT = "https://ark.cn-beijing.volces.com/api/v3/images/generations";
    public static final int DEFAULT_MAX_COMPLETION_TOKENS = 2048;

    private static final String CHAT_COMPLETIONS_PATH = "chat/completions";
    private static final String IMAGE_GENERATIONS_PATH = "images/generations";

    public ProviderProperties {
        apiKey = blankToNull(apiKey);
        textEndpoint = blankToNull(textEndpoint);
        imageEndpoint = blankToNull(imageEndpoint);
        textModel = textModel == null || textModel.isBlank() ? DEFAULT_TEXT_MODEL : textModel.trim();
        imageModel = imageModel == null || imageModel.isBlank() ? DEFAULT_IMAGE_MODEL : imageModel.trim();

        if (maxCompletionTokens == null) {
            maxCompletionTokens = DEFAULT_MAX_COMPLETION_TOKENS;
        } else if (maxCompletionTokens <= 0) {
            throw new IllegalArgumentException("shopcraft.provider.max-completion-tokens must be positive: " + maxCompletionTokens);
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(10);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(60);
        }
    }

    /**
     * 프로바이더 없이 mock/로컬 폴백만 사용하는 설정
     */
    public static ProviderProperties disabled() {
        return new ProviderProperties(null, null, null, null, null, null, null, null);
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    /**
     * 텍스트 생성 가능 여부 (키 + 엔드포인트 모두 필요)
     */
    public boolean isTextGenerationEnabled() {
        return apiKey != null && textEndpoint != null;
    }

    /**
     * 이미지 엔드포인트 결정
     * 1. 전용 엔드포인트 설정값
     * 2. 텍스트 엔드포인트의 chat/completions → images/generations 치환
     * 3. 기본 엔드포인트
     */
    public String resolveImageEndpoint() {
        if (imageEndpoint != null) {
            return imageEndpoint;
        }
        if (textEndpoint != null && textEndpoint.contains("/" + CHAT_COMPLETIONS_PATH)) {
            return textEndpoint.replace(CHAT_COMPLETIONS_PATH, IMAGE_GENERATIONS_PATH);
        }
        return DEFAULT_IMAGE_ENDPOINT;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
