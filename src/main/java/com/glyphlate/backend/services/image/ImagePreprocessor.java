package com.glyphlate.backend.services.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

import org.springframework.stereotype.Component;

import com.glyphlate.backend.config.ImageTranslationProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Downsamples images whose longest side exceeds the configured maximum so OCR stays bounded.
 */
@Component
@Slf4j
public class ImagePreprocessor {

    private final int maxDimension;

    public ImagePreprocessor(ImageTranslationProperties properties) {
        this.maxDimension = Math.max(1, properties.getImage().getMaxDimension());
    }

    /**
     * Returns {@code image} itself with scale 1 when it already fits; otherwise a resized copy
     * (aspect ratio kept, dimensions rounded) and {@code scale = maxDimension / longestSide}.
     */
    public PreprocessedImage preprocess(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int maxDim = Math.max(width, height);

        if (maxDim <= maxDimension) {
            return new PreprocessedImage(image, 1, width, height);
        }

        double scale = (double) maxDimension / maxDim;
        int newWidth = Math.max(1, (int) Math.round(width * scale));
        int newHeight = Math.max(1, (int) Math.round(height * scale));

        log.info("[ImagePipeline] Scaling image from {}x{} to {}x{} (scale: {})",
                width, height, newWidth, newHeight, String.format("%.2f", scale));

        return new PreprocessedImage(resize(image, newWidth, newHeight), scale, width, height);
    }

    private static BufferedImage resize(BufferedImage source, int width, int height) {
        int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage resized = new BufferedImage(width, height, type);

        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }
}
