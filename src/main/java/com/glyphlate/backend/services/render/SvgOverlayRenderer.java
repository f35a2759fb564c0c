package com.glyphlate.backend.services.render;

import java.util.List;

import org.springframework.stereotype.Component;

import com.glyphlate.backend.config.ImageTranslationProperties;
import com.glyphlate.backend.services.ocr.BoundingBox;
import com.glyphlate.backend.services.translation.TranslatedBlock;

/**
 * Builds a standalone SVG overlay with the same geometry and font fitting as
 * {@link TranslatedImageRenderer}, for clients that composite on their side.
 */
@Component
public class SvgOverlayRenderer {

    private final RenderOptions defaults;

    public SvgOverlayRenderer(ImageTranslationProperties properties) {
        this.defaults = RenderOptions.from(properties.getRender());
    }

    public String render(int width, int height, List<TranslatedBlock> blocks, RenderOptions options) {
        RenderOptions opts = defaults.overriddenBy(options);
        int padding = opts.paddingOrZero();

        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" ")
                .append("width=\"").append(width).append("\" ")
                .append("height=\"").append(height).append("\" ")
                .append("viewBox=\"0 0 ").append(width).append(' ').append(height).append("\">\n");

        for (TranslatedBlock block : blocks) {
            String translated = block.translatedText();
            if (translated == null || translated.isBlank()) continue;

            BoundingBox bbox = block.bbox();
            int blockWidth = Math.max(1, bbox.width());
            int blockHeight = Math.max(1, bbox.height());

            double fontSize = FontFitter.fitFontSize(translated, blockWidth, blockHeight, block.fontSize());
            String visible = FontFitter.truncate(translated, blockWidth, fontSize);

            svg.append("  <g transform=\"translate(").append(bbox.x0()).append(' ').append(bbox.y0()).append(")\">\n");
            svg.append("    <rect x=\"0\" y=\"0\" width=\"").append(blockWidth)
                    .append("\" height=\"").append(blockHeight)
                    .append("\" fill=\"").append(escapeMarkup(opts.backgroundColor())).append("\"/>\n");
            svg.append("    <text x=\"").append(padding)
                    .append("\" y=\"").append(formatNumber(blockHeight * 0.75))
                    .append("\" font-family=\"").append(escapeMarkup(opts.fontFamily()))
                    .append("\" font-size=\"").append(formatNumber(fontSize))
                    .append("\" fill=\"").append(escapeMarkup(opts.textColor())).append("\">")
                    .append(escapeMarkup(visible))
                    .append("</text>\n");
            svg.append("  </g>\n");
        }

        svg.append("</svg>\n");
        return svg.toString();
    }

    static String escapeMarkup(String text) {
        if (text == null) return "";
        return text
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
