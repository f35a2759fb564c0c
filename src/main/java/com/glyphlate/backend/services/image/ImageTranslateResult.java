package com.glyphlate.backend.services.image;

import java.util.List;

import com.glyphlate.backend.services.ocr.OcrResult;

/**
 * @param image          rendered output, or the untouched upload when no text was found
 * @param mediaType      MIME type of {@code image}
 * @param sourceLanguage language the blocks were translated from (detected when "auto" was asked)
 * @param translations   one entry per OCR block, same order
 */
public record ImageTranslateResult(
        byte[] image,
        String mediaType,
        String sourceLanguage,
        OcrResult ocrResult,
        List<TranslationPair> translations
) {

    public ImageTranslateResult {
        translations = translations == null ? List.of() : List.copyOf(translations);
    }
}
