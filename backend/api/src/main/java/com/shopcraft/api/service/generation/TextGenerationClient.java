package com.shopcraft.api.service.generation;

import com.shopcraft.api.service.provider.ProviderResult;

import java.util.List;

/**
 * 원격 텍스트/멀티모달 모델 클라이언트
 * 예외를 던지지 않음 - 모든 실패는 ProviderResult 실패로 반환
 */
public interface TextGenerationClient {

    /**
     * @param turns 시스템 지시문부터 현재 턴까지 순서대로
     * @param modelOverride 모델 오버라이드 (nullable → 설정값)
     * @return 첫 번째 completion 의 텍스트 (가공 없음)
     */
    ProviderResult<String> generate(List<ChatTurn> turns, String modelOverride);
}
