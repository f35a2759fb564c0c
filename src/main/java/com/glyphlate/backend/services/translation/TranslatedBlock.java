package com.glyphlate.backend.services.translation;

import com.glyphlate.backend.services.ocr.BoundingBox;
import com.glyphlate.backend.services.ocr.TextBlock;

/**
 * A {@link TextBlock} with its translation. Geometry is in the coordinate space of the
 * original (unscaled) image once the batch translator has run.
 */
public record TranslatedBlock(
        String text,
        double confidence,
        BoundingBox bbox,
        BoundingBox baseline,
        int fontSize,
        int lineHeight,
        String translatedText
) {

    public static TranslatedBlock of(TextBlock block, String translatedText) {
        return new TranslatedBlock(
                block.text(),
                block.confidence(),
                block.bbox(),
                block.baseline(),
                block.fontSize(),
                block.lineHeight(),
                translatedText
        );
    }

    /**
     * Divides bbox, font size and line height by {@code scale}. The baseline is carried unchanged.
     */
    public static TranslatedBlock unscaled(TextBlock block, double scale, String translatedText) {
        return new TranslatedBlock(
                block.text(),
                block.confidence(),
                block.bbox().unscale(scale),
                block.baseline(),
                BoundingBox.unscale(block.fontSize(), scale),
                BoundingBox.unscale(block.lineHeight(), scale),
                translatedText
        );
    }
}
