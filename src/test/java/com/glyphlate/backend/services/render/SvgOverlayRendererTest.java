package com.glyphlate.backend.services.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.glyphlate.backend.config.ImageTranslationProperties;
import com.glyphlate.backend.services.ocr.BoundingBox;
import com.glyphlate.backend.services.translation.TranslatedBlock;

class SvgOverlayRendererTest {

    private final SvgOverlayRenderer renderer = new SvgOverlayRenderer(new ImageTranslationProperties());

    @Test
    void render_escapesMarkupInTranslatedText() {
        TranslatedBlock block = block(new BoundingBox(10, 20, 210, 60), "Fish & <Chips>");

        String svg = renderer.render(300, 100, List.of(block), null);

        assertTrue(svg.contains("width=\"300\" height=\"100\""));
        assertTrue(svg.contains("translate(10 20)"));
        assertTrue(svg.contains("<rect x=\"0\" y=\"0\" width=\"200\" height=\"40\" fill=\"#FFFFFF\"/>"));
        assertTrue(svg.contains(">Fish &amp; &lt;Chips&gt;</text>"));
        assertFalse(svg.contains("<Chips>"));
    }

    @Test
    void render_skipsBlankTranslations() {
        String svg = renderer.render(100, 100, List.of(block(new BoundingBox(0, 0, 50, 20), " ")), null);

        assertFalse(svg.contains("<rect"));
    }

    @Test
    void escapeMarkup_allSpecialCharacters() {
        assertEquals("&amp;&lt;&gt;&quot;&#39;", SvgOverlayRenderer.escapeMarkup("&<>\"'"));
    }

    @Test
    void render_usesOverrides() {
        TranslatedBlock block = block(new BoundingBox(0, 0, 100, 20), "Hi");

        String svg = renderer.render(100, 20, List.of(block), new RenderOptions("black", "#fff", "serif", 2));

        assertTrue(svg.contains("fill=\"black\""));
        assertTrue(svg.contains("font-family=\"serif\""));
        assertTrue(svg.contains("<text x=\"2\" y=\"15\""));
    }

    private static TranslatedBlock block(BoundingBox bbox, String translated) {
        return new TranslatedBlock("src", 0.9, bbox, bbox, 16, bbox.height(), translated);
    }
}
