package com.glyphlate.backend.services.render;

/**
 * Font sizing without font metrics: every glyph is assumed to be {@code 0.6 * fontSize} wide.
 */
public final class FontFitter {

    static final double AVG_CHAR_WIDTH_RATIO = 0.6;
    static final double MAX_HEIGHT_RATIO = 0.8;
    static final double MIN_FONT_SIZE = 8;
    static final String ELLIPSIS = "…";

    private FontFitter() {
    }

    /**
     * Shrinks {@code originalFontSize} proportionally when the estimated text width exceeds
     * {@code maxWidth}, caps it at 80% of {@code maxHeight} and floors it at 8.
     */
    public static double fitFontSize(String text, int maxWidth, int maxHeight, int originalFontSize) {
        double avgCharWidth = originalFontSize * AVG_CHAR_WIDTH_RATIO;
        double estimatedWidth = text.length() * avgCharWidth;

        double fontSize = originalFontSize;
        if (estimatedWidth > maxWidth) {
            fontSize = Math.floor(maxWidth / estimatedWidth * originalFontSize);
        }

        fontSize = Math.min(fontSize, maxHeight * MAX_HEIGHT_RATIO);

        return Math.max(MIN_FONT_SIZE, fontSize);
    }

    /**
     * Cuts {@code text} to the characters that fit at {@code fontSize}; the last kept slot
     * holds an ellipsis.
     */
    public static String truncate(String text, int maxWidth, double fontSize) {
        double avgCharWidth = fontSize * AVG_CHAR_WIDTH_RATIO;
        int maxChars = (int) Math.floor(maxWidth / avgCharWidth);

        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, Math.max(0, maxChars - 1)) + ELLIPSIS;
    }
}
