package com.glyphlate.backend.services.translation;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.glyphlate.backend.config.ImageTranslationProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for single-text translation: cache lookup, optional routing through a pivot
 * language, then the {@link TranslationEngine}.
 */
@Service
@Slf4j
public class PivotTranslationClient {

    private final TranslationEngine engine;
    private final TranslationCache cache;
    private final String pivotLanguage;

    public PivotTranslationClient(TranslationEngine engine, TranslationCache cache, ImageTranslationProperties properties) {
        this.engine = engine;
        this.cache = cache;
        String pivot = properties.getTranslation().getPivotLanguage();
        this.pivotLanguage = pivot == null ? "" : pivot.trim();
    }

    /**
     * @param extraFlag forwarded to the engine as its format hint
     */
    public String translate(String fromLang, String toLang, String text, boolean extraFlag) {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        if (fromLang != null && fromLang.equalsIgnoreCase(toLang)) {
            return text;
        }

        Optional<String> cached = cache.read(fromLang, toLang, text, extraFlag);
        if (cached.isPresent()) {
            return cached.get();
        }

        String result;
        if (shouldPivot(fromLang, toLang)) {
            log.debug("[Translate] Pivoting {} -> {} -> {}", fromLang, pivotLanguage, toLang);
            String intermediate = engine.translate(fromLang, pivotLanguage, text, extraFlag);
            result = engine.translate(pivotLanguage, toLang, intermediate, extraFlag);
        } else {
            result = engine.translate(fromLang, toLang, text, extraFlag);
        }

        cache.write(result, fromLang, toLang, text, extraFlag);
        return result;
    }

    private boolean shouldPivot(String fromLang, String toLang) {
        return !pivotLanguage.isEmpty()
                && !pivotLanguage.equalsIgnoreCase(fromLang)
                && !pivotLanguage.equalsIgnoreCase(toLang);
    }
}
