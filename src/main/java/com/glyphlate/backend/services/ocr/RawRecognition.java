package com.glyphlate.backend.services.ocr;

import java.util.List;

/**
 * Unprocessed engine output.
 *
 * @param confidence overall confidence, 0..100
 */
public record RawRecognition(String text, List<RecognizedLine> lines, double confidence) {

    public RawRecognition {
        text = text == null ? "" : text;
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
