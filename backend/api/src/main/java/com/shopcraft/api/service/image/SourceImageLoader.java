package com.shopcraft.api.service.image;

import com.shopcraft.api.util.ImageRefValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * 이미지 참조(data URL 또는 http/https URL) → BufferedImage
 * 어떤 실패든 HeroImageSourceException
 */
@Slf4j
@Component
public class SourceImageLoader {

    private final WebClient webClient;

    public SourceImageLoader(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    public BufferedImage load(String imageRef) {
        if (imageRef == null || imageRef.isBlank()) {
            throw new HeroImageSourceException("Source image reference is empty");
        }
        byte[] bytes = ImageRefValidator.isDataUrl(imageRef) ? decodeDataUrl(imageRef) : download(imageRef);

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new HeroImageSourceException("Source image could not be decoded", e);
        }
        if (image == null) {
            throw new HeroImageSourceException("Unsupported image format: " + ImageRefValidator.truncate(imageRef, 100));
        }
        return image;
    }

    private byte[] decodeDataUrl(String dataUrl) {
        int comma = dataUrl.indexOf(',');
        if (comma < 0 || !dataUrl.substring(0, comma).endsWith(";base64")) {
            throw new HeroImageSourceException("Data URL is not base64 encoded");
        }
        try {
            return Base64.getDecoder().decode(dataUrl.substring(comma + 1).trim());
        } catch (IllegalArgumentException e) {
            throw new HeroImageSourceException("Data URL payload is not valid base64", e);
        }
    }

    private byte[] download(String url) {
        if (!ImageRefValidator.isRemote(url)) {
            throw new HeroImageSourceException("Unsupported image reference: " + ImageRefValidator.truncate(url, 100));
        }
        byte[] bytes;
        try {
            bytes = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();
        } catch (RuntimeException e) {
            log.warn("[HERO] Source image download failed: {} - {}", ImageRefValidator.truncate(url, 100), e.getMessage());
            throw new HeroImageSourceException("Source image could not be downloaded", e);
        }
        if (bytes == null || bytes.length == 0) {
            throw new HeroImageSourceException("Source image is empty");
        }
        return bytes;
    }
}
