package com.glyphlate.backend.services.ocr;

import java.util.List;

/**
 * @param confidence overall confidence, 0..1
 * @param language   native engine code that produced the result (e.g. "eng")
 */
public record OcrResult(String text, List<TextBlock> blocks, double confidence, String language) {

    public OcrResult {
        text = text == null ? "" : text;
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
