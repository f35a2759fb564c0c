package com.glyphlate.backend.services.language;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ScriptLanguageDetectorTest {

    private final ScriptLanguageDetector detector = new ScriptLanguageDetector();

    @Test
    void detect_cjk() {
        assertEquals("ja", detector.detect("東京へようこそ"));
        assertEquals("zh", detector.detect("欢迎来到北京"));
        assertEquals("ko", detector.detect("서울에 오신 것을 환영합니다"));
    }

    @Test
    void detect_otherScripts() {
        assertEquals("ru", detector.detect("Добро пожаловать"));
        assertEquals("ar", detector.detect("مرحبا بكم"));
        assertEquals("th", detector.detect("ยินดีต้อนรับ"));
    }

    @Test
    void detect_latinDiacritics() {
        assertEquals("vi", detector.detect("Chào mừng đến Việt Nam"));
        assertEquals("es", detector.detect("¿Dónde está la estación?"));
        assertEquals("pt", detector.detect("Não fumar"));
        assertEquals("de", detector.detect("Ausgang für Fußgänger"));
        assertEquals("fr", detector.detect("Défense de fumer"));
    }

    @Test
    void detect_plainAsciiOrBlank_defaultsToEnglish() {
        assertEquals("en", detector.detect("EXIT ONLY"));
        assertEquals("en", detector.detect("   "));
        assertEquals("en", detector.detect(null));
    }

    @Test
    void detect_mixedScripts_picksDominant() {
        assertEquals("ru", detector.detect("Москва 北京 Санкт-Петербург"));
    }
}
