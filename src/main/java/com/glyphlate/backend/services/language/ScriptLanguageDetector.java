package com.glyphlate.backend.services.language;

import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

/**
 * Offline detector based on Unicode scripts and a few language-specific Latin letters.
 * Good enough to pick an OCR language pack; not a general-purpose classifier.
 */
@Slf4j
public class ScriptLanguageDetector implements LanguageDetector {

    static final String DEFAULT_LANGUAGE = "en";

    private static final Pattern KANA_PATTERN = Pattern.compile("[\\u3040-\\u309F\\u30A0-\\u30FF]");
    private static final Pattern HANGUL_PATTERN = Pattern.compile("[\\uAC00-\\uD7A3\\u1100-\\u11FF\\u3130-\\u318F]");
    private static final Pattern HAN_PATTERN = Pattern.compile("[\\u4E00-\\u9FFF\\u3400-\\u4DBF]");
    private static final Pattern CYRILLIC_PATTERN = Pattern.compile("[\\u0400-\\u04FF]");
    private static final Pattern ARABIC_PATTERN = Pattern.compile("[\\u0600-\\u06FF]");
    private static final Pattern THAI_PATTERN = Pattern.compile("[\\u0E00-\\u0E7F]");

    private static final Pattern VIETNAMESE_PATTERN = Pattern.compile(
            "[ăắằẳẵặấầẩẫậđếềểễệốồổỗộơớờởỡợưứừửữựảẻỉỏủỳỷỹỵạẹịọụẽĩũĂĐƠƯ]"
    );
    private static final Pattern SPANISH_PATTERN = Pattern.compile("[ñÑ¿¡]");
    private static final Pattern PORTUGUESE_PATTERN = Pattern.compile("[ãõÃÕ]");
    private static final Pattern GERMAN_PATTERN = Pattern.compile("[äöüßÄÖÜ]");
    private static final Pattern FRENCH_PATTERN = Pattern.compile("[éèêëàâçîïôûùœÉÈÊÀÇŒ]");

    @Override
    public String detect(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT_LANGUAGE;
        }

        // Kana only exists in Japanese; Han alone is treated as Chinese.
        if (countMatches(text, KANA_PATTERN) > 0) {
            return "ja";
        }

        String best = null;
        int bestCount = 0;
        String[] codes = {"ko", "zh", "ru", "ar", "th"};
        Pattern[] patterns = {HANGUL_PATTERN, HAN_PATTERN, CYRILLIC_PATTERN, ARABIC_PATTERN, THAI_PATTERN};
        for (int i = 0; i < codes.length; i++) {
            int count = countMatches(text, patterns[i]);
            if (count > bestCount) {
                bestCount = count;
                best = codes[i];
            }
        }
        if (best != null) {
            return best;
        }

        if (countMatches(text, VIETNAMESE_PATTERN) > 0) return "vi";
        if (countMatches(text, SPANISH_PATTERN) > 0) return "es";
        if (countMatches(text, PORTUGUESE_PATTERN) > 0) return "pt";
        if (countMatches(text, GERMAN_PATTERN) > 0) return "de";
        if (countMatches(text, FRENCH_PATTERN) > 0) return "fr";

        log.debug("[Detect] No script marker found, using '{}'", DEFAULT_LANGUAGE);
        return DEFAULT_LANGUAGE;
    }

    private static int countMatches(String text, Pattern pattern) {
        int count = 0;
        var matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
