package com.shopcraft.api.service.image;

import com.shopcraft.api.service.provider.ProviderResult;

/**
 * 원격 이미지 생성 모델 클라이언트 (예외를 던지지 않음)
 */
public interface ImageCompositionClient {

    /**
     * @return 합성된 이미지 URL
     */
    ProviderResult<String> compose(CompositionRequest request);
}
