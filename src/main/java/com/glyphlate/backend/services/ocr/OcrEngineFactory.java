package com.glyphlate.backend.services.ocr;

public interface OcrEngineFactory {

    /**
     * Creates an engine for the given native language code (e.g. "eng", "chi_sim").
     *
     * @throws OcrException if the engine cannot be initialized
     */
    OcrEngine create(String nativeLanguage);
}
