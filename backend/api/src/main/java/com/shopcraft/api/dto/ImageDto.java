package com.shopcraft.api.dto;

import com.shopcraft.api.service.image.HeroImageSource;
import lombok.*;

/**
 * 대표(hero) 이미지 API DTO
 */
public class ImageDto {

    /**
     * 대표 이미지 생성 요청
     * prompt 와 asset 중 하나는 필요 (prompt 가 있으면 우선 사용)
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HeroRequest {
        private String imageUrl;        // 원본 상품 이미지 참조 (필수)
        private String prompt;          // 합성 지시문 (옵션)
        private AssetDto.Asset asset;   // 생성된 소재 (옵션)
        private String size;            // 크기 태그 (기본 2K)
        private String accentColor;     // 로컬 합성 강조색 (#RRGGBB)
    }

    /**
     * 대표 이미지 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HeroResponse {
        private String url;               // 원격 URL 또는 data:image/png;base64,...
        private HeroImageSource source;   // REMOTE / LOCAL
    }
}
