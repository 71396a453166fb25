package com.shopcraft.api.service.generation;

import com.shopcraft.api.dto.AssetDto;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 파이프라인 결과 - 소재와 그 소재를 만든 단계
 */
@Getter
@ToString
@AllArgsConstructor
public class GeneratedAsset {
    private final AssetDto.Asset asset;
    private final GenerationStage stage;
}
