package com.glyphlate.backend.services.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OcrLanguageMapperTest {

    @ParameterizedTest
    @CsvSource({
            "en, eng",
            "zh, chi_sim",
            "zh-Hans, chi_sim",
            "zh-Hant, chi_tra",
            "ja, jpn",
            "ko, kor",
            "fr, fra",
            "de, deu",
            "es, spa",
            "it, ita",
            "pt, por",
            "ru, rus",
            "ar, ara",
            "vi, vie",
            "th, tha"
    })
    void toNative_knownCodes(String language, String expected) {
        assertEquals(expected, OcrLanguageMapper.toNative(language));
    }

    @Test
    void toNative_unknownOrNull_fallsBackToEnglish() {
        assertEquals("eng", OcrLanguageMapper.toNative("xx"));
        assertEquals("eng", OcrLanguageMapper.toNative(null));
    }
}
