package com.glyphlate.backend.services.render;

import com.glyphlate.backend.config.ImageTranslationProperties;

/**
 * Drawing options for translated blocks. A null field means "use the default"; see
 * {@link #overriddenBy(RenderOptions)}.
 *
 * @param backgroundColor patch drawn over the original text, e.g. "#FFFFFF"
 * @param textColor       e.g. "#000000"
 * @param fontFamily      CSS-like family name ("sans-serif", "serif", "monospace" or a font name)
 * @param padding         left inset of the text inside the block, px
 */
public record RenderOptions(String backgroundColor, String textColor, String fontFamily, Integer padding) {

    public static final RenderOptions DEFAULT = new RenderOptions("#FFFFFF", "#000000", "sans-serif", 4);

    public static RenderOptions empty() {
        return new RenderOptions(null, null, null, null);
    }

    public static RenderOptions from(ImageTranslationProperties.Render render) {
        return DEFAULT.overriddenBy(new RenderOptions(
                render.getBackgroundColor(),
                render.getTextColor(),
                render.getFontFamily(),
                render.getPadding()
        ));
    }

    /**
     * Copy of this with every non-blank field of {@code overrides} applied.
     */
    public RenderOptions overriddenBy(RenderOptions overrides) {
        if (overrides == null) return this;
        return new RenderOptions(
                pick(overrides.backgroundColor, backgroundColor),
                pick(overrides.textColor, textColor),
                pick(overrides.fontFamily, fontFamily),
                overrides.padding != null ? overrides.padding : padding
        );
    }

    public int paddingOrZero() {
        return padding == null ? 0 : padding;
    }

    private static String pick(String override, String current) {
        return override != null && !override.isBlank() ? override.trim() : current;
    }
}
