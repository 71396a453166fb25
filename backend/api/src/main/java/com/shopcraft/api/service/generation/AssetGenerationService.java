package com.shopcraft.api.service.generation;

import com.shopcraft.api.dto.AssetDto;
import com.shopcraft.api.service.provider.ProviderResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 소재 생성 파이프라인
 * 1. 전체 맥락(이력 포함) 시도
 * 2. 실패 시 최소 맥락(시스템 지시문 + 현재 설명) 재시도
 * 3. 실패 시 모의 소재 (항상 성공)
 *
 * 실패 원인(설정 없음/통신/파싱)은 구분하지 않고 동일하게 다음 단계로 넘어감
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetGenerationService {

    private final AssetPromptBuilder promptBuilder;
    private final TextGenerationClient textClient;
    private final AssetResponseExtractor extractor;
    private final MockAssetFactory mockAssetFactory;

    public GeneratedAsset generate(GenerationRequest request) {
        log.info("[ASSET] Generation start - descriptionLength: {}, historyTurns: {}, hasImage: {}",
                request.getDescription().length(), request.getHistory().size(), request.getImageRef() != null);

        ProviderResult<AssetDto.Asset> full = attempt(GenerationStage.FULL_CONTEXT, promptBuilder.buildFull(request), request);
        if (full.isSuccess()) {
            return done(full.getValue(), GenerationStage.FULL_CONTEXT);
        }

        ProviderResult<AssetDto.Asset> minimal = attempt(GenerationStage.MINIMAL_CONTEXT, promptBuilder.buildMinimal(request), request);
        if (minimal.isSuccess()) {
            return done(minimal.getValue(), GenerationStage.MINIMAL_CONTEXT);
        }

        return done(mockAssetFactory.create(request.getDescription()), GenerationStage.MOCK);
    }

    private ProviderResult<AssetDto.Asset> attempt(GenerationStage stage, List<ChatTurn> turns, GenerationRequest request) {
        log.info("[ASSET] {} attempt - turns: {}", stage, turns.size());
        ProviderResult<String> text = textClient.generate(turns, request.getModelOverride());
        ProviderResult<AssetDto.Asset> result = text.isSuccess()
                ? extractor.extract(text.getValue())
                : text.propagateFailure();
        if (!result.isSuccess()) {
            log.warn("[ASSET] {} failed - {}: {}", stage, result.getFailureKind(), result.getDetail());
        }
        return result;
    }

    private GeneratedAsset done(AssetDto.Asset asset, GenerationStage stage) {
        log.info("[ASSET] Asset produced by {} - title: {}", stage, asset.getTitle());
        return new GeneratedAsset(asset, stage);
    }
}
