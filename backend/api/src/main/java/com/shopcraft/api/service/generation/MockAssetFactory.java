package com.shopcraft.api.service.generation;

import com.shopcraft.api.dto.AssetDto;
import com.shopcraft.common.prompt.AssetPrompts;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 네트워크 없이 설명만으로 결정적인 모의 소재 생성 (실패하지 않음)
 */
@Component
public class MockAssetFactory {

    public AssetDto.Asset create(String description) {
        List<AssetDto.Segment> script = new ArrayList<>();
        for (int i = 0; i < AssetPrompts.MOCK_SCRIPT_CAPTIONS.size(); i++) {
            script.add(AssetDto.Segment.builder()
                    .startSecond(AssetPrompts.MOCK_SCRIPT_SECONDS.get(i))
                    .description(AssetPrompts.MOCK_SCRIPT_CAPTIONS.get(i))
                    .build());
        }

        return AssetDto.Asset.builder()
                .title(mockTitle(description))
                .sellingPoints(new ArrayList<>(AssetPrompts.MOCK_SELLING_POINTS))
                .atmosphere(AssetPrompts.MOCK_ATMOSPHERE)
                .videoScript(script)
                .build();
    }

    /**
     * 설명 앞 24자 (코드포인트 기준, 공백 유지), 비어 있거나 공백뿐이면 기본 제목
     */
    static String mockTitle(String description) {
        if (description == null || description.isBlank()) {
            return AssetPrompts.MOCK_TITLE;
        }
        int codePoints = description.codePointCount(0, description.length());
        if (codePoints <= AssetPrompts.MOCK_TITLE_MAX_LENGTH) {
            return description;
        }
        return description.substring(0, description.offsetByCodePoints(0, AssetPrompts.MOCK_TITLE_MAX_LENGTH));
    }
}
