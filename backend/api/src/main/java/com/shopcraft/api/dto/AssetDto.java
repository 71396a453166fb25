package com.shopcraft.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * 전자상거래 마케팅 소재 DTO
 * JSON 필드명은 모델 출력 계약과 동일 (title, selling_points, atmosphere, video_script[{s, v}])
 */
public class AssetDto {

    /**
     * 생성된 소재 묶음
     * 요청마다 새로 만들어지며 파이프라인은 생성 후 수정하지 않음
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    public static class Asset {
        private String title;                 // 상품 제목 (10-30자 권장)

        @JsonProperty("selling_points")
        private List<String> sellingPoints;   // 셀링 포인트 (3-5개 권장)

        private String atmosphere;            // 분위기 태그 (예: 焕新季)

        @JsonProperty("video_script")
        private List<Segment> videoScript;    // 숏폼 영상 스크립트
    }

    /**
     * 영상 스크립트 구간
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    public static class Segment {
        @JsonProperty("s")
        private int startSecond;

        @JsonProperty("v")
        private String description;
    }
}
