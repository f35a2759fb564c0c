package com.glyphlate.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "glyphlate.ocr")
public class OcrProperties {

    /**
     * Enables the Tesseract engine. When false every recognition request fails.
     */
    private boolean enabled = true;

    /**
     * Language used for the first OCR pass when the source language is "auto".
     */
    private String defaultLanguage = "en";

    /**
     * Optional path that contains the "*.traineddata" files.
     * If empty, Tess4J/Tesseract will rely on OS installation and TESSDATA_PREFIX.
     */
    private String tessdataPath = "";

    /**
     * Tesseract page segmentation mode (3 = fully automatic).
     */
    private int pageSegMode = 3;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }

    public int getPageSegMode() {
        return pageSegMode;
    }

    public void setPageSegMode(int pageSegMode) {
        this.pageSegMode = pageSegMode;
    }
}
