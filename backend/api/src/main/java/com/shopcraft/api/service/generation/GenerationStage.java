package com.shopcraft.api.service.generation;

/**
 * 소재를 만들어낸 단계
 */
public enum GenerationStage {
    FULL_CONTEXT,
    MINIMAL_CONTEXT,
    MOCK
}
