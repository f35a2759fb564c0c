package com.glyphlate.backend.services.language;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class LanguageDetectionService {

    private final LanguageDetector detector;

    public String detectLanguage(String text) {
        String detected = detector.detect(text);
        log.debug("[Detect] '{}' -> {}", abbreviate(text), detected);
        return detected;
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        String t = text.strip();
        return t.length() <= 30 ? t : t.substring(0, 30) + "...";
    }
}
