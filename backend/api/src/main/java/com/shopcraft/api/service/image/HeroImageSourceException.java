package com.shopcraft.api.service.image;

import com.shopcraft.common.exception.ApiException;
import com.shopcraft.common.exception.ErrorCode;

/**
 * 로컬 합성용 원본 이미지를 읽을 수 없음
 * 원격/로컬 모두 불가능한 유일한 경우라 그대로 전파됨
 */
public class HeroImageSourceException extends ApiException {

    public HeroImageSourceException(String message) {
        super(ErrorCode.HERO_IMAGE_SOURCE_UNREADABLE, message);
    }

    public HeroImageSourceException(String message, Throwable cause) {
        super(ErrorCode.HERO_IMAGE_SOURCE_UNREADABLE, message, cause);
    }
}
