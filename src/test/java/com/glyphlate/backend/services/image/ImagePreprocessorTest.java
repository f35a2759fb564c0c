package com.glyphlate.backend.services.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

import com.glyphlate.backend.config.ImageTranslationProperties;

class ImagePreprocessorTest {

    private final ImagePreprocessor preprocessor = new ImagePreprocessor(new ImageTranslationProperties());

    @Test
    void preprocess_smallImage_isReturnedUnchanged() {
        BufferedImage image = new BufferedImage(2000, 800, BufferedImage.TYPE_INT_RGB);

        PreprocessedImage result = preprocessor.preprocess(image);

        assertSame(image, result.image());
        assertEquals(1, result.scale());
        assertFalse(result.isScaled());
    }

    @Test
    void preprocess_wideImage_isDownsampled() {
        BufferedImage image = new BufferedImage(3000, 1000, BufferedImage.TYPE_INT_RGB);

        PreprocessedImage result = preprocessor.preprocess(image);

        assertEquals(2000, result.image().getWidth());
        assertEquals(667, result.image().getHeight());
        assertEquals(2000.0 / 3000.0, result.scale(), 1e-9);
        assertEquals(3000, result.originalWidth());
        assertEquals(1000, result.originalHeight());
        assertTrue(result.isScaled());
    }

    @Test
    void preprocess_tallImage_usesHeightAsLongestSide() {
        ImageTranslationProperties props = new ImageTranslationProperties();
        props.getImage().setMaxDimension(100);
        ImagePreprocessor small = new ImagePreprocessor(props);

        PreprocessedImage result = small.preprocess(new BufferedImage(50, 400, BufferedImage.TYPE_INT_ARGB));

        assertEquals(13, result.image().getWidth());
        assertEquals(100, result.image().getHeight());
        assertEquals(0.25, result.scale(), 1e-9);
        assertTrue(result.image().getColorModel().hasAlpha());
    }
}
