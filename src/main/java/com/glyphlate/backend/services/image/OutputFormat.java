package com.glyphlate.backend.services.image;

import java.util.Locale;

public enum OutputFormat {
    PNG,
    SVG;

    /**
     * Blank maps to {@link #PNG}; unknown values are rejected.
     */
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) return PNG;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "png", "image" -> PNG;
            case "svg" -> SVG;
            default -> throw new IllegalArgumentException("Unsupported output format: " + value);
        };
    }
}
