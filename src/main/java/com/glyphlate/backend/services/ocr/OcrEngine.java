package com.glyphlate.backend.services.ocr;

import java.awt.image.BufferedImage;

/**
 * A recognition engine bound to a single native language. Instances are created by an
 * {@link OcrEngineFactory} and owned by {@link RecognitionService}.
 */
public interface OcrEngine {

    RawRecognition recognize(BufferedImage image);

    /**
     * Releases the engine. The instance must not be used afterwards.
     */
    void terminate();
}
