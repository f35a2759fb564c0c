package com.glyphlate.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * An initialized Tesseract instance for one language. Not thread-safe.
 */
interface TesseractHandle {

    /**
     * Runs recognition on {@code image} and returns its text lines in reading order.
     *
     * @throws OcrException when recognition fails
     */
    List<RecognizedLine> recognizeLines(BufferedImage image);

    void release();
}
