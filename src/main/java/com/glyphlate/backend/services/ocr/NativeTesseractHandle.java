package com.glyphlate.backend.services.ocr;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.IntBuffer;
import java.util.ArrayList;
import java.util.List;

import com.sun.jna.Pointer;

import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITessAPI.TessBaseAPI;
import net.sourceforge.tess4j.ITessAPI.TessPageIterator;
import net.sourceforge.tess4j.ITessAPI.TessPageIteratorLevel;
import net.sourceforge.tess4j.ITessAPI.TessResultIterator;
import net.sourceforge.tess4j.TessAPI1;

/**
 * Keeps one {@code TessBaseAPI} initialized for the lifetime of the handle, so the language data is
 * loaded once instead of on every recognition.
 */
final class NativeTesseractHandle implements TesseractHandle {

    private static final int LEVEL = TessPageIteratorLevel.RIL_TEXTLINE;

    private final String language;
    private TessBaseAPI api;

    private NativeTesseractHandle(String language, TessBaseAPI api) {
        this.language = language;
        this.api = api;
    }

    /**
     * @param datapath directory holding "*.traineddata", or null for the library default
     *                 (TESSDATA_PREFIX)
     * @throws OcrException when Tesseract cannot load {@code language}
     */
    static NativeTesseractHandle open(String datapath, String language, int pageSegMode) {
        TessBaseAPI api = TessAPI1.TessBaseAPICreate();
        int rc = TessAPI1.TessBaseAPIInit3(api, datapath, language);
        if (rc != 0) {
            TessAPI1.TessBaseAPIDelete(api);
            throw new OcrException("Tesseract failed to initialize language '" + language + "' (code " + rc + ")", null);
        }
        TessAPI1.TessBaseAPISetPageSegMode(api, pageSegMode);
        return new NativeTesseractHandle(language, api);
    }

    @Override
    public List<RecognizedLine> recognizeLines(BufferedImage image) {
        if (api == null) {
            throw new IllegalStateException("Tesseract handle (" + language + ") was released");
        }

        // 8-bit gray: one byte per pixel, rows tightly packed
        BufferedImage gray = toGray(image);
        byte[] pixels = ((DataBufferByte) gray.getRaster().getDataBuffer()).getData();
        ByteBuffer buffer = ByteBuffer.allocateDirect(pixels.length).order(ByteOrder.nativeOrder());
        buffer.put(pixels);
        buffer.flip();

        TessAPI1.TessBaseAPISetImage(api, buffer, gray.getWidth(), gray.getHeight(), 1, gray.getWidth());
        try {
            int rc = TessAPI1.TessBaseAPIRecognize(api, null);
            if (rc != 0) {
                throw new OcrException("Tesseract recognition failed (" + language + ", code " + rc + ")", null);
            }
            return readLines();
        } finally {
            TessAPI1.TessBaseAPIClear(api);
        }
    }

    @Override
    public void release() {
        if (api == null) return;
        try {
            TessAPI1.TessBaseAPIEnd(api);
            TessAPI1.TessBaseAPIDelete(api);
        } finally {
            api = null;
        }
    }

    private List<RecognizedLine> readLines() {
        TessResultIterator ri = TessAPI1.TessBaseAPIGetIterator(api);
        if (ri == null) {
            return List.of();
        }

        List<RecognizedLine> lines = new ArrayList<>();
        try {
            TessPageIterator pi = TessAPI1.TessResultIteratorGetPageIterator(ri);
            TessAPI1.TessPageIteratorBegin(pi);
            do {
                Pointer ptr = TessAPI1.TessResultIteratorGetUTF8Text(ri, LEVEL);
                if (ptr == null) continue;
                String text = ptr.getString(0, "UTF-8");
                TessAPI1.TessDeleteText(ptr);

                BoundingBox bbox = boundingBox(pi);
                if (bbox == null) continue;

                float confidence = TessAPI1.TessResultIteratorConfidence(ri, LEVEL);
                lines.add(new RecognizedLine(text, confidence, bbox, baseline(pi)));
            } while (TessAPI1.TessPageIteratorNext(pi, LEVEL) == ITessAPI.TRUE);
        } finally {
            TessAPI1.TessResultIteratorDelete(ri);
        }
        return lines;
    }

    private static BoundingBox boundingBox(TessPageIterator pi) {
        IntBuffer left = IntBuffer.allocate(1);
        IntBuffer top = IntBuffer.allocate(1);
        IntBuffer right = IntBuffer.allocate(1);
        IntBuffer bottom = IntBuffer.allocate(1);
        if (TessAPI1.TessPageIteratorBoundingBox(pi, LEVEL, left, top, right, bottom) != ITessAPI.TRUE) {
            return null;
        }
        return new BoundingBox(left.get(0), top.get(0), right.get(0), bottom.get(0));
    }

    private static BoundingBox baseline(TessPageIterator pi) {
        IntBuffer x1 = IntBuffer.allocate(1);
        IntBuffer y1 = IntBuffer.allocate(1);
        IntBuffer x2 = IntBuffer.allocate(1);
        IntBuffer y2 = IntBuffer.allocate(1);
        if (TessAPI1.TessPageIteratorBaseline(pi, LEVEL, x1, y1, x2, y2) != ITessAPI.TRUE) {
            return null;
        }
        return new BoundingBox(x1.get(0), y1.get(0), x2.get(0), y2.get(0));
    }

    private static BufferedImage toGray(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY
                && image.getRaster().getDataBuffer() instanceof DataBufferByte
                && image.getRaster().getDataBuffer().getSize() == image.getWidth() * image.getHeight()) {
            return image;
        }
        BufferedImage gray = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return gray;
    }
}
