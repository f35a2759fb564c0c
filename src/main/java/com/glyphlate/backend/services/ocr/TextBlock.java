package com.glyphlate.backend.services.ocr;

/**
 * A recognized line of text, geometry in the coordinate space of the image given to OCR.
 *
 * @param confidence normalized to 0..1
 */
public record TextBlock(
        String text,
        double confidence,
        BoundingBox bbox,
        BoundingBox baseline,
        int fontSize,
        int lineHeight
) {
}
