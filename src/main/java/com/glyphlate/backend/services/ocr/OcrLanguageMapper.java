package com.glyphlate.backend.services.ocr;

import java.util.Map;

/**
 * Maps user-facing language codes to Tesseract's native codes.
 */
public final class OcrLanguageMapper {

    public static final String FALLBACK_NATIVE = "eng";

    private static final Map<String, String> LANG_MAP = Map.ofEntries(
            Map.entry("en", "eng"),
            Map.entry("zh", "chi_sim"),
            Map.entry("zh-Hans", "chi_sim"),
            Map.entry("zh-Hant", "chi_tra"),
            Map.entry("ja", "jpn"),
            Map.entry("ko", "kor"),
            Map.entry("fr", "fra"),
            Map.entry("de", "deu"),
            Map.entry("es", "spa"),
            Map.entry("it", "ita"),
            Map.entry("pt", "por"),
            Map.entry("ru", "rus"),
            Map.entry("ar", "ara"),
            Map.entry("vi", "vie"),
            Map.entry("th", "tha")
    );

    private OcrLanguageMapper() {
    }

    /**
     * Unmapped or null codes fall back to {@value #FALLBACK_NATIVE}.
     */
    public static String toNative(String language) {
        if (language == null) return FALLBACK_NATIVE;
        return LANG_MAP.getOrDefault(language.trim(), FALLBACK_NATIVE);
    }
}
