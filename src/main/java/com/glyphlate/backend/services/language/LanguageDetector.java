package com.glyphlate.backend.services.language;

public interface LanguageDetector {

    /**
     * Best-guess ISO-style language code for {@code text} (e.g. "en", "ja").
     */
    String detect(String text);
}
