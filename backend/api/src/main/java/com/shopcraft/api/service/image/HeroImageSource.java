package com.shopcraft.api.service.image;

/**
 * 대표 이미지 출처
 */
public enum HeroImageSource {
    REMOTE,  // 이미지 모델이 반환한 URL
    LOCAL    // 로컬 합성 (data:image/png;base64,...)
}
