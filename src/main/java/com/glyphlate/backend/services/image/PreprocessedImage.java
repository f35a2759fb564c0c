package com.glyphlate.backend.services.image;

import java.awt.image.BufferedImage;

/**
 * Image handed to OCR plus the factor it was scaled by ({@code 1} when untouched).
 */
public record PreprocessedImage(BufferedImage image, double scale, int originalWidth, int originalHeight) {

    public boolean isScaled() {
        return scale != 1;
    }
}
