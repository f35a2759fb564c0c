package com.glyphlate.backend.services.ocr;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "glyphlate.ocr", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OcrEngineFactory tesseractOcrEngineFactory(OcrProperties ocrProperties) {
        log.info("[OCR] Enabled: defaultLanguage='{}' tessdataPath='{}' pageSegMode={}",
                safe(ocrProperties.getDefaultLanguage()),
                safe(ocrProperties.getTessdataPath()),
                ocrProperties.getPageSegMode());
        return new TesseractOcrEngineFactory(ocrProperties);
    }

    @Bean
    @ConditionalOnMissingBean(OcrEngineFactory.class)
    public OcrEngineFactory disabledOcrEngineFactory() {
        log.info("[OCR] Disabled (glyphlate.ocr.enabled=false)");
        return new DisabledOcrEngineFactory();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
