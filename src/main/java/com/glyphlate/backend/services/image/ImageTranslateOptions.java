package com.glyphlate.backend.services.image;

import com.glyphlate.backend.services.language.LanguageCodes;
import com.glyphlate.backend.services.render.RenderOptions;

/**
 * @param fromLang      source language, {@code "auto"} to detect it from a first OCR pass
 * @param toLang        target language, required
 * @param renderOptions per-request overrides of the configured render defaults
 * @param format        raster output or SVG overlay
 */
public record ImageTranslateOptions(String fromLang, String toLang, RenderOptions renderOptions, OutputFormat format) {

    public ImageTranslateOptions {
        fromLang = LanguageCodes.isAuto(fromLang) ? LanguageCodes.AUTO : fromLang.trim();
        renderOptions = renderOptions == null ? RenderOptions.empty() : renderOptions;
        format = format == null ? OutputFormat.PNG : format;
    }

    public ImageTranslateOptions(String fromLang, String toLang) {
        this(fromLang, toLang, null, null);
    }
}
