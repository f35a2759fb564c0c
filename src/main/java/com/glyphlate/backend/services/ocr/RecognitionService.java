package com.glyphlate.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the single process-wide OCR engine.
 *
 * <p>Only one engine (one language) is alive at a time. Every access to the slot goes through
 * {@link #slotLock}: callers that arrive while another caller is initializing wait on the lock
 * and re-check the slot once they hold it, so a language that was just loaded by someone else is
 * not loaded twice. Recognition also runs under the lock, which keeps a concurrent language
 * switch from terminating the engine mid-recognition.
 */
@Service
@Slf4j
public class RecognitionService {

    private static final int MIN_FONT_SIZE = 12;

    private final OcrEngineFactory engineFactory;

    private final ReentrantLock slotLock = new ReentrantLock(true);

    // guarded by slotLock
    private OcrEngine engine;
    private String currentLanguage = "";
    private int initializations;

    public RecognitionService(OcrEngineFactory engineFactory) {
        this.engineFactory = engineFactory;
    }

    /**
     * Makes sure the engine is loaded for {@code language} (user-facing code, mapped to the native
     * code). No-op when it already is.
     *
     * @return the native language code now active
     */
    public String ensureReady(String language) {
        String nativeLanguage = OcrLanguageMapper.toNative(language);
        slotLock.lock();
        try {
            ensureReadyLocked(nativeLanguage);
            return currentLanguage;
        } finally {
            slotLock.unlock();
        }
    }

    public OcrResult recognize(BufferedImage image, String language) {
        if (image == null) {
            throw new IllegalArgumentException("image is null");
        }
        String nativeLanguage = OcrLanguageMapper.toNative(language);

        slotLock.lock();
        try {
            ensureReadyLocked(nativeLanguage);

            OcrEngine active = engine;
            if (active == null) {
                throw new IllegalStateException("OCR engine not initialized");
            }

            log.info("[OCR] Starting recognition: {}x{} lang={}", image.getWidth(), image.getHeight(), currentLanguage);
            long startMs = System.currentTimeMillis();

            RawRecognition raw = active.recognize(image);
            List<TextBlock> blocks = toBlocks(raw.lines());

            log.info("[OCR] Completed: blocks={} confidence={}% elapsedMs={}",
                    blocks.size(), Math.round(raw.confidence()), System.currentTimeMillis() - startMs);

            return new OcrResult(raw.text(), blocks, raw.confidence() / 100.0, currentLanguage);
        } finally {
            slotLock.unlock();
        }
    }

    @PreDestroy
    public void terminate() {
        slotLock.lock();
        try {
            if (engine != null) {
                engine.terminate();
                engine = null;
                currentLanguage = "";
                log.info("[OCR] Engine terminated");
            }
        } finally {
            slotLock.unlock();
        }
    }

    public String getCurrentLanguage() {
        slotLock.lock();
        try {
            return currentLanguage;
        } finally {
            slotLock.unlock();
        }
    }

    int getInitializationCount() {
        slotLock.lock();
        try {
            return initializations;
        } finally {
            slotLock.unlock();
        }
    }

    private void ensureReadyLocked(String nativeLanguage) {
        if (engine != null && currentLanguage.equals(nativeLanguage)) {
            return;
        }

        if (engine != null) {
            log.info("[OCR] Terminating previous engine ({})", currentLanguage);
            try {
                engine.terminate();
            } finally {
                engine = null;
                currentLanguage = "";
            }
        }

        log.info("[OCR] Initializing engine for language: {}", nativeLanguage);
        try {
            engine = engineFactory.create(nativeLanguage);
        } catch (OcrException e) {
            log.error("[OCR] Failed to initialize engine ({}): {}", nativeLanguage, e.getMessage());
            throw e;
        } catch (RuntimeException | LinkageError e) {
            log.error("[OCR] Failed to initialize engine ({}): {}", nativeLanguage, e.toString());
            throw new OcrException("Failed to initialize OCR engine for " + nativeLanguage, e);
        }
        currentLanguage = nativeLanguage;
        initializations++;
        log.info("[OCR] Engine initialized for {}", nativeLanguage);
    }

    private static List<TextBlock> toBlocks(List<RecognizedLine> lines) {
        List<TextBlock> blocks = new ArrayList<>(lines.size());
        for (RecognizedLine line : lines) {
            String text = line.text() == null ? "" : line.text().trim();
            if (text.isEmpty()) continue;

            BoundingBox bbox = line.bbox();
            int lineHeight = bbox.height();
            int fontSize = Math.max(MIN_FONT_SIZE, (int) Math.round(lineHeight * 0.75));

            BoundingBox baseline = line.baseline() != null
                    ? line.baseline()
                    : new BoundingBox(bbox.x0(), bbox.y1(), bbox.x1(), bbox.y1());

            blocks.add(new TextBlock(text, line.confidence() / 100.0, bbox, baseline, fontSize, lineHeight));
        }
        return blocks;
    }
}
