package com.glyphlate.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Tesseract engine for one language, backed by a handle that stays initialized until
 * {@link #terminate()}. Callers ({@link RecognitionService}) serialize access.
 */
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    private final String language;
    private TesseractHandle handle;

    TesseractOcrEngine(String language, TesseractHandle handle) {
        this.language = language;
        this.handle = handle;
    }

    /**
     * Full text is the recognized lines joined by newlines; overall confidence is the mean over
     * lines that carry text.
     */
    @Override
    public RawRecognition recognize(BufferedImage image) {
        TesseractHandle current = handle;
        if (current == null) {
            throw new IllegalStateException("Tesseract engine (" + language + ") was terminated");
        }

        List<RecognizedLine> lines;
        try {
            lines = current.recognizeLines(image);
        } catch (OcrException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            throw new OcrException("Failed to run OCR (Tesseract, " + language + ")", e);
        }

        StringBuilder text = new StringBuilder();
        double confidenceSum = 0;
        int textLines = 0;

        for (RecognizedLine line : lines) {
            String lineText = line.text() == null ? "" : line.text().stripTrailing();
            text.append(lineText).append('\n');
            if (!lineText.isBlank()) {
                confidenceSum += line.confidence();
                textLines++;
            }
        }

        double confidence = textLines == 0 ? 0 : confidenceSum / textLines;
        return new RawRecognition(text.toString(), lines, confidence);
    }

    @Override
    public void terminate() {
        TesseractHandle current = handle;
        handle = null;
        if (current != null) {
            current.release();
            log.debug("[OCR] Tesseract handle released ({})", language);
        }
    }
}
