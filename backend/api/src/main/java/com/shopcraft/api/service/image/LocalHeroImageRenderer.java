package com.shopcraft.api.service.image;

import com.shopcraft.common.exception.ApiException;
import com.shopcraft.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * 네트워크 없는 로컬 대표 이미지 합성
 * 흰 정사각 캔버스 + 비율 유지 중앙 배치 + 강조색 테두리 + 하단 텍스트
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalHeroImageRenderer {

    public static final int CANVAS_SIZE = 1024;
    public static final int BORDER_INSET = 24;
    public static final int BORDER_WIDTH = 8;
    public static final int FONT_SIZE = 40;
    public static final int TEXT_BOTTOM_OFFSET = 72;
    public static final String DEFAULT_ACCENT = "#2563EB";

    private static final String ELLIPSIS = "…";

    private final SourceImageLoader sourceImageLoader;

    /**
     * @return data:image/png;base64,...
     * @throws HeroImageSourceException 원본 이미지를 읽을 수 없는 경우
     */
    public String composeLocally(String sourceImageRef, String overlayText, String accentColor) {
        BufferedImage source = sourceImageLoader.load(sourceImageRef);
        Color accent = parseAccent(accentColor);

        BufferedImage canvas = new BufferedImage(CANVAS_SIZE, CANVAS_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = canvas.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_GASP);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);

            g2d.setColor(Color.WHITE);
            g2d.fillRect(0, 0, CANVAS_SIZE, CANVAS_SIZE);

            // 1. 원본 (비율 유지, 중앙)
            double scale = scaleFactor(source.getWidth(), source.getHeight());
            int w = (int) Math.round(source.getWidth() * scale);
            int h = (int) Math.round(source.getHeight() * scale);
            g2d.drawImage(source, (CANVAS_SIZE - w) / 2, (CANVAS_SIZE - h) / 2, w, h, null);

            // 2. 테두리
            g2d.setColor(accent);
            g2d.setStroke(new BasicStroke(BORDER_WIDTH));
            g2d.drawRect(BORDER_INSET, BORDER_INSET, CANVAS_SIZE - BORDER_INSET * 2, CANVAS_SIZE - BORDER_INSET * 2);

            // 3. 하단 텍스트
            if (overlayText != null && !overlayText.isBlank()) {
                g2d.setFont(new Font(Font.SANS_SERIF, Font.BOLD, FONT_SIZE));
                FontMetrics metrics = g2d.getFontMetrics();
                String line = fitToWidth(overlayText.trim(), metrics, CANVAS_SIZE - (BORDER_INSET + BORDER_WIDTH) * 2 - 16);
                int x = (CANVAS_SIZE - metrics.stringWidth(line)) / 2;
                g2d.drawString(line, x, CANVAS_SIZE - TEXT_BOTTOM_OFFSET);
            }
        } finally {
            g2d.dispose();
        }

        String payload = "data:image/png;base64," + Base64.getEncoder().encodeToString(encodePng(canvas));
        log.info("[HERO] Local composition complete - source: {}x{}, payload length: {}",
                source.getWidth(), source.getHeight(), payload.length());
        return payload;
    }

    /**
     * 캔버스에 들어가는 균일 배율 (가로/세로 중 작은 값)
     */
    public static double scaleFactor(int imageWidth, int imageHeight) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + imageWidth + "x" + imageHeight);
        }
        return Math.min((double) CANVAS_SIZE / imageWidth, (double) CANVAS_SIZE / imageHeight);
    }

    static Color parseAccent(String accentColor) {
        if (accentColor == null || accentColor.isBlank()) {
            return Color.decode(DEFAULT_ACCENT);
        }
        try {
            return Color.decode(accentColor.trim());
        } catch (NumberFormatException e) {
            log.warn("[HERO] Invalid accent color '{}', using {}", accentColor, DEFAULT_ACCENT);
            return Color.decode(DEFAULT_ACCENT);
        }
    }

    private static String fitToWidth(String text, FontMetrics metrics, int maxWidth) {
        if (metrics.stringWidth(text) <= maxWidth) {
            return text;
        }
        int end = text.length();
        while (end > 0 && metrics.stringWidth(text.substring(0, end) + ELLIPSIS) > maxWidth) {
            end = text.offsetByCodePoints(end, -1);
        }
        return text.substring(0, end) + ELLIPSIS;
    }

    private static byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new ApiException(ErrorCode.HERO_IMAGE_ENCODING_FAILED, "PNG encoding failed", e);
        }
    }
}
