package com.glyphlate.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "glyphlate")
public class ImageTranslationProperties {

    private Image image = new Image();

    private Translation translation = new Translation();

    private Cache cache = new Cache();

    private Render render = new Render();

    private Detector detector = new Detector();

    public Image getImage() {
        return image;
    }

    public void setImage(Image image) {
        this.image = image;
    }

    public Translation getTranslation() {
        return translation;
    }

    public void setTranslation(Translation translation) {
        this.translation = translation;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Detector getDetector() {
        return detector;
    }

    public void setDetector(Detector detector) {
        this.detector = detector;
    }

    public static class Image {

        /**
         * Longest side (px) fed to OCR. Larger images are downsampled before recognition.
         */
        private int maxDimension = 2000;

        public int getMaxDimension() {
            return maxDimension;
        }

        public void setMaxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
        }
    }

    public static class Translation {

        /**
         * Base URL of the LibreTranslate-compatible translation service.
         */
        private String baseUrl = "http://localhost:5000";

        /**
         * Optional API key sent as "api_key".
         */
        private String apiKey = "";

        /**
         * Intermediate language used when neither side of a request is this language.
         * Empty disables pivot routing.
         */
        private String pivotLanguage = "";

        /**
         * Max translation calls in flight per chunk of text blocks.
         */
        private int batchSize = 10;

        private int timeoutSeconds = 30;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getPivotLanguage() {
            return pivotLanguage;
        }

        public void setPivotLanguage(String pivotLanguage) {
            this.pivotLanguage = pivotLanguage;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Cache {

        /**
         * Max cached translations. 0 or less disables the cache.
         */
        private int size = 1000;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }
    }

    public static class Render {

        private String backgroundColor = "#FFFFFF";

        private String textColor = "#000000";

        private String fontFamily = "sans-serif";

        private int padding = 4;

        public String getBackgroundColor() {
            return backgroundColor;
        }

        public void setBackgroundColor(String backgroundColor) {
            this.backgroundColor = backgroundColor;
        }

        public String getTextColor() {
            return textColor;
        }

        public void setTextColor(String textColor) {
            this.textColor = textColor;
        }

        public String getFontFamily() {
            return fontFamily;
        }

        public void setFontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
        }

        public int getPadding() {
            return padding;
        }

        public void setPadding(int padding) {
            this.padding = padding;
        }
    }

    public static class Detector {

        /**
         * "script" (local Unicode-script heuristic) or "remote" (the translation service's /detect).
         */
        private String mode = "script";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }
}
