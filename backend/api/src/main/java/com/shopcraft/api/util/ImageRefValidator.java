package com.shopcraft.api.util;

import lombok.extern.slf4j.Slf4j;

/**
 * 이미지 참조(URL / data URL) 검증 유틸리티
 * - 업로드 협력자가 넘겨준 참조가 모델/로컬 합성에서 읽을 수 있는 형식인지 확인
 * - 에러 문자열이 이미지 참조로 흘러들어가는 것을 방지
 */
@Slf4j
public final class ImageRefValidator {

    private static final String[] REMOTE_PREFIXES = {
            "http://",
            "https://"
    };

    private static final String DATA_URL_PREFIX = "data:image/";

    // 무효한 프리픽스 목록 (에러 메시지 등)
    private static final String[] INVALID_PREFIXES = {
            "ERROR:",
            "error:",
            "FAILED:",
            "failed:",
            "Exception:",
            "null"
    };

    private ImageRefValidator() {}

    /**
     * 이미지 참조가 유효한 형식인지 검증
     */
    public static boolean isValid(String ref) {
        if (ref == null || ref.isBlank()) {
            return false;
        }

        String trimmed = ref.trim();
        for (String invalidPrefix : INVALID_PREFIXES) {
            if (trimmed.startsWith(invalidPrefix)) {
                log.warn("[ImageRefValidator] Invalid image ref (starts with '{}'): {}", invalidPrefix, truncate(trimmed, 100));
                return false;
            }
        }

        if (isRemote(trimmed) || isDataUrl(trimmed)) {
            return true;
        }

        log.warn("[ImageRefValidator] Unknown image ref format: {}", truncate(trimmed, 100));
        return false;
    }

    public static boolean isRemote(String ref) {
        if (ref == null) return false;
        for (String prefix : REMOTE_PREFIXES) {
            if (ref.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isDataUrl(String ref) {
        return ref != null && ref.startsWith(DATA_URL_PREFIX);
    }

    /**
     * 유효하면 반환, 무효하면 예외 발생
     * @throws IllegalArgumentException 무효한 참조
     */
    public static String validateOrThrow(String ref, String fieldName) {
        if (!isValid(ref)) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s: %s", fieldName, truncate(ref, 100)));
        }
        return ref.trim();
    }

    /**
     * 문자열 자르기 (로깅용 - data URL 전체가 로그에 찍히지 않도록)
     */
    public static String truncate(String str, int maxLength) {
        if (str == null) return "null";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength) + "...";
    }
}
