package com.glyphlate.backend.services.render;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.glyphlate.backend.config.ImageTranslationProperties;
import com.glyphlate.backend.services.image.ImageCodec;
import com.glyphlate.backend.services.ocr.BoundingBox;
import com.glyphlate.backend.services.translation.TranslatedBlock;

import lombok.extern.slf4j.Slf4j;

/**
 * Paints translated blocks over the original image: an opaque patch over each block's bbox,
 * then the fitted text left-aligned with its baseline at 75% of the block height.
 */
@Component
@Slf4j
public class TranslatedImageRenderer {

    private static final double BASELINE_RATIO = 0.75;

    private final ImageCodec imageCodec;
    private final RenderOptions defaults;

    public TranslatedImageRenderer(ImageCodec imageCodec, ImageTranslationProperties properties) {
        this.imageCodec = imageCodec;
        this.defaults = RenderOptions.from(properties.getRender());
    }

    /**
     * @return PNG bytes, same dimensions as {@code original}; {@code original} is not modified
     */
    public byte[] render(BufferedImage original, List<TranslatedBlock> blocks, RenderOptions options) {
        RenderOptions opts = defaults.overriddenBy(options);
        Color background = ColorParser.parse(opts.backgroundColor());
        Color textColor = ColorParser.parse(opts.textColor());
        Font baseFont = new Font(toAwtFamily(opts.fontFamily()), Font.PLAIN, 12);
        int padding = opts.paddingOrZero();

        log.info("[Render] Rendering {} translated blocks (simple mode)", blocks.size());

        BufferedImage canvas = copyOf(original);
        Graphics2D g = canvas.createGraphics();
        int drawn = 0;
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            for (TranslatedBlock block : blocks) {
                String translated = block.translatedText();
                if (translated == null || translated.isBlank()) continue;

                BoundingBox bbox = block.bbox();
                int blockWidth = Math.max(1, bbox.width());
                int blockHeight = Math.max(1, bbox.height());

                double fontSize = FontFitter.fitFontSize(translated, blockWidth, blockHeight, block.fontSize());
                String visible = FontFitter.truncate(translated, blockWidth, fontSize);

                g.setClip(bbox.x0(), bbox.y0(), blockWidth, blockHeight);

                g.setColor(background);
                g.fillRect(bbox.x0(), bbox.y0(), blockWidth, blockHeight);

                g.setColor(textColor);
                g.setFont(baseFont.deriveFont((float) fontSize));
                g.drawString(visible, (float) (bbox.x0() + padding), (float) (bbox.y0() + blockHeight * BASELINE_RATIO));

                g.setClip(null);
                drawn++;
            }
        } finally {
            g.dispose();
        }

        byte[] result = imageCodec.encodePng(canvas);
        log.info("[Render] Completed: blocksDrawn={} outputBytes={}", drawn, result.length);
        return result;
    }

    private static BufferedImage copyOf(BufferedImage source) {
        int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), type);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    static String toAwtFamily(String family) {
        if (family == null) return Font.SANS_SERIF;
        return switch (family.trim().toLowerCase(Locale.ROOT)) {
            case "sans-serif", "sans" -> Font.SANS_SERIF;
            case "serif" -> Font.SERIF;
            case "monospace" -> Font.MONOSPACED;
            default -> family.trim();
        };
    }
}
