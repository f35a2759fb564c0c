package com.glyphlate.backend.services.ocr;

public class DisabledOcrEngineFactory implements OcrEngineFactory {

    @Override
    public OcrEngine create(String nativeLanguage) {
        throw new OcrException("OCR is disabled. Enable it with glyphlate.ocr.enabled=true", null);
    }
}
