package com.shopcraft.api.controller;

import com.shopcraft.api.dto.ImageDto;
import com.shopcraft.api.service.image.HeroImage;
import com.shopcraft.api.service.image.HeroImageService;
import com.shopcraft.api.util.ImageRefValidator;
import com.shopcraft.common.dto.ApiResponse;
import com.shopcraft.common.exception.ApiException;
import com.shopcraft.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/image")
@Tag(name = "Hero Image", description = "대표 이미지 API")
public class ImageController {

    private final HeroImageService heroImageService;

    @PostMapping
    @Operation(summary = "대표 이미지 생성",
            description = "이미지 모델로 대표 이미지를 합성합니다. 실패 시 로컬 합성 결과(data URL)를 반환합니다.")
    public ApiResponse<ImageDto.HeroResponse> generate(@RequestBody ImageDto.HeroRequest request) {
        if (request.getImageUrl() == null || request.getImageUrl().isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "imageUrl is required");
        }
        if ((request.getPrompt() == null || request.getPrompt().isBlank()) && request.getAsset() == null) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "prompt or asset is required");
        }
        ImageRefValidator.validateOrThrow(request.getImageUrl(), "imageUrl");

        HeroImage image = heroImageService.generate(request.getImageUrl(), request.getPrompt(),
                request.getAsset(), request.getSize(), request.getAccentColor());
        log.info("[HeroImage] Generated - source: {}", image.getSource());
        return ApiResponse.success(ImageDto.HeroResponse.builder()
                .url(image.getUrl())
                .source(image.getSource())
                .build());
    }
}
