package com.glyphlate.backend.services.ocr;

/**
 * One line as reported by an {@link OcrEngine}.
 *
 * @param confidence engine scale, 0..100
 * @param baseline   may be null when the engine has no baseline information
 */
public record RecognizedLine(String text, double confidence, BoundingBox bbox, BoundingBox baseline) {
}
