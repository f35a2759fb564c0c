package com.glyphlate.backend.services.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class TesseractOcrEngineTest {

    private final TesseractHandle handle = mock(TesseractHandle.class);
    private final TesseractOcrEngine engine = new TesseractOcrEngine("eng", handle);
    private final BufferedImage image = new BufferedImage(200, 80, BufferedImage.TYPE_INT_RGB);

    @Test
    void recognize_joinsLinesAndKeepsGeometry() {
        BoundingBox first = new BoundingBox(10, 5, 120, 25);
        BoundingBox second = new BoundingBox(10, 40, 90, 60);
        BoundingBox baseline = new BoundingBox(10, 22, 120, 23);
        when(handle.recognizeLines(image)).thenReturn(List.of(
                new RecognizedLine("Exit here  \n", 90, first, baseline),
                new RecognizedLine("Push door\n", 80, second, null)
        ));

        RawRecognition raw = engine.recognize(image);

        assertEquals("Exit here\nPush door\n", raw.text());
        assertEquals(2, raw.lines().size());
        assertSame(first, raw.lines().get(0).bbox());
        assertSame(baseline, raw.lines().get(0).baseline());
        assertEquals(second, raw.lines().get(1).bbox());
        assertEquals(85, raw.confidence(), 1e-9);
    }

    @Test
    void recognize_blankLinesDoNotLowerConfidence() {
        when(handle.recognizeLines(image)).thenReturn(Arrays.asList(
                new RecognizedLine("Exit", 90, new BoundingBox(0, 0, 40, 20), null),
                new RecognizedLine("   \n", 0, new BoundingBox(0, 30, 40, 50), null),
                new RecognizedLine(null, 5, new BoundingBox(0, 60, 40, 70), null),
                new RecognizedLine("Open", 70, new BoundingBox(0, 80, 40, 100), null)
        ));

        RawRecognition raw = engine.recognize(image);

        assertEquals(80, raw.confidence(), 1e-9);
        assertEquals(4, raw.lines().size());
    }

    @Test
    void recognize_noText_reportsZeroConfidence() {
        when(handle.recognizeLines(image)).thenReturn(List.of());

        RawRecognition raw = engine.recognize(image);

        assertEquals("", raw.text());
        assertEquals(0, raw.confidence());
    }

    @Test
    void recognize_handleFailure_isPropagatedAsOcrException() {
        OcrException failure = new OcrException("Tesseract recognition failed (eng, code -1)", null);
        when(handle.recognizeLines(any())).thenThrow(failure);

        OcrException ex = assertThrows(OcrException.class, () -> engine.recognize(image));

        assertSame(failure, ex);
    }

    @Test
    void recognize_nativeError_isWrapped() {
        when(handle.recognizeLines(any())).thenThrow(new UnsatisfiedLinkError("libtesseract"));

        OcrException ex = assertThrows(OcrException.class, () -> engine.recognize(image));

        assertTrue(ex.getMessage().contains("eng"));
        assertTrue(ex.getCause() instanceof UnsatisfiedLinkError);
    }

    @Test
    void terminate_releasesHandleOnce() {
        engine.terminate();
        engine.terminate();

        verify(handle, times(1)).release();
        assertThrows(IllegalStateException.class, () -> engine.recognize(image));
    }

    @Test
    void recognize_reusesTheSameHandle() {
        when(handle.recognizeLines(image)).thenReturn(List.of());

        engine.recognize(image);
        engine.recognize(image);

        verify(handle, times(2)).recognizeLines(image);
    }
}
