package com.shopcraft.api.service.image;

import com.shopcraft.api.dto.AssetDto;
import com.shopcraft.api.service.generation.AssetPromptBuilder;
import com.shopcraft.api.service.provider.ProviderResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 대표 이미지 생성
 * 원격 합성 1회 시도 → 실패 시 곧바로 로컬 합성 (원격 재시도 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HeroImageService {

    static final String OVERLAY_SEPARATOR = " · ";
    private static final int OVERLAY_MAX_POINTS = 3;

    private final ImageCompositionClient compositionClient;
    private final LocalHeroImageRenderer localRenderer;
    private final AssetPromptBuilder promptBuilder;

    /**
     * @param prompt 합성 지시문 (nullable → asset 으로 생성)
     * @param asset 소재 (nullable, prompt 가 없으면 필수)
     * @throws HeroImageSourceException 원격 실패 후 원본 이미지도 읽을 수 없는 경우
     */
    public HeroImage generate(String imageRef, String prompt, AssetDto.Asset asset, String size, String accentColor) {
        boolean hasPrompt = prompt != null && !prompt.isBlank();
        if (!hasPrompt && asset == null) {
            throw new IllegalArgumentException("prompt or asset is required");
        }
        String instruction = hasPrompt ? prompt.trim() : promptBuilder.buildHeroInstruction(asset);

        ProviderResult<String> remote = compositionClient.compose(new CompositionRequest(imageRef, instruction, size));
        if (remote.isSuccess()) {
            log.info("[HERO] Remote composition succeeded");
            return new HeroImage(remote.getValue(), HeroImageSource.REMOTE);
        }

        log.warn("[HERO] Remote composition failed - {}: {} → local fallback", remote.getFailureKind(), remote.getDetail());
        String overlay = asset != null ? overlayText(asset) : instruction;
        return new HeroImage(localRenderer.composeLocally(imageRef, overlay, accentColor), HeroImageSource.LOCAL);
    }

    /**
     * 제목 + 셀링포인트(최대 3개) + 분위기
     */
    static String overlayText(AssetDto.Asset asset) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, asset.getTitle());
        if (asset.getSellingPoints() != null) {
            asset.getSellingPoints().stream()
                    .limit(OVERLAY_MAX_POINTS)
                    .forEach(p -> addIfPresent(parts, p));
        }
        addIfPresent(parts, asset.getAtmosphere());
        return String.join(OVERLAY_SEPARATOR, parts);
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }
}
