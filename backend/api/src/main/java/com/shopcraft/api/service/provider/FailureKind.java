package com.shopcraft.api.service.provider;

/**
 * 프로바이더 호출 실패 원인
 */
public enum FailureKind {
    CONFIG_MISSING,      // 키/엔드포인트 미설정 (네트워크 호출 없음)
    TRANSPORT,           // 연결 실패, 타임아웃
    NON_SUCCESS_STATUS,  // 2xx 이외 응답
    MALFORMED_PAYLOAD,   // 응답에 기대 필드 없음
    PARSE_FAILURE        // 텍스트에서 JSON 추출/파싱 실패
}
