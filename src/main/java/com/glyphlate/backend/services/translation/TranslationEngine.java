package com.glyphlate.backend.services.translation;

public interface TranslationEngine {

    /**
     * @param html format hint; {@code true} asks the engine to preserve markup
     * @throws TranslationException when the engine fails or returns nothing
     */
    String translate(String fromLang, String toLang, String text, boolean html);
}
