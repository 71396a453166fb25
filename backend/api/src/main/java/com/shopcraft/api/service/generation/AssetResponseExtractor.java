package com.shopcraft.api.service.generation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcraft.api.dto.AssetDto;
import com.shopcraft.api.service.provider.FailureKind;
import com.shopcraft.api.service.provider.ProviderResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 모델 출력(자유 텍스트)에서 소재 JSON 추출
 * 첫 '{' ~ 마지막 '}' 구간을 파싱, 구간이 없으면 전체 텍스트를 파싱
 * 구간 뒤에 남는 토큰이 있으면 파싱 실패, 필드 존재 여부는 검사하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssetResponseExtractor {

    private final ObjectMapper objectMapper;

    public ProviderResult<AssetDto.Asset> extract(String rawText) {
        if (rawText == null) {
            return ProviderResult.failure(FailureKind.PARSE_FAILURE, "no text");
        }

        String candidate = rawText;
        int start = rawText.indexOf('{');
        int end = rawText.lastIndexOf('}');
        if (start >= 0 && end > start) {
            candidate = rawText.substring(start, end + 1);
        }

        try {
            AssetDto.Asset asset = objectMapper.readerFor(AssetDto.Asset.class)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(candidate);
            if (asset == null) {
                return ProviderResult.failure(FailureKind.PARSE_FAILURE, "null literal");
            }
            return ProviderResult.success(asset);
        } catch (Exception e) {
            log.debug("[EXTRACT] Parse failed: {}", e.getMessage());
            return ProviderResult.failure(FailureKind.PARSE_FAILURE, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
