package com.glyphlate.backend.services.image;

public record TranslationPair(String original, String translated) {
}
