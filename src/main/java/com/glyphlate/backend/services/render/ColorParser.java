package com.glyphlate.backend.services.render;

import java.awt.Color;
import java.util.Locale;
import java.util.Map;

final class ColorParser {

    private static final Map<String, Color> NAMED = Map.of(
            "white", Color.WHITE,
            "black", Color.BLACK,
            "red", Color.RED,
            "green", Color.GREEN,
            "blue", Color.BLUE,
            "yellow", Color.YELLOW,
            "gray", Color.GRAY,
            "grey", Color.GRAY,
            "transparent", new Color(0, 0, 0, 0)
    );

    private ColorParser() {
    }

    /**
     * Accepts "#RGB", "#RRGGBB", "#RRGGBBAA" and a few color names.
     */
    static Color parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Color is empty");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);

        Color named = NAMED.get(v);
        if (named != null) return named;

        if (!v.startsWith("#")) {
            throw new IllegalArgumentException("Invalid color: " + value);
        }
        String hex = v.substring(1);
        try {
            switch (hex.length()) {
                case 3:
                    return new Color(
                            Integer.parseInt(hex.substring(0, 1).repeat(2), 16),
                            Integer.parseInt(hex.substring(1, 2).repeat(2), 16),
                            Integer.parseInt(hex.substring(2, 3).repeat(2), 16));
                case 6:
                    return new Color(Integer.parseInt(hex, 16));
                case 8:
                    return new Color(
                            Integer.parseInt(hex.substring(0, 2), 16),
                            Integer.parseInt(hex.substring(2, 4), 16),
                            Integer.parseInt(hex.substring(4, 6), 16),
                            Integer.parseInt(hex.substring(6, 8), 16));
                default:
                    throw new IllegalArgumentException("Invalid color: " + value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid color: " + value, e);
        }
    }
}
