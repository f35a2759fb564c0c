package com.glyphlate.backend.services.ocr;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens a native Tesseract handle per language. Initialization failures (missing language data,
 * missing native library) surface here rather than on the first recognition.
 */
public class TesseractOcrEngineFactory implements OcrEngineFactory {

    private final OcrProperties ocrProperties;

    public TesseractOcrEngineFactory(OcrProperties ocrProperties) {
        this.ocrProperties = ocrProperties;
    }

    @Override
    public OcrEngine create(String nativeLanguage) {
        String datapath = ocrProperties.getTessdataPath();
        boolean customDatapath = datapath != null && !datapath.isBlank();
        if (customDatapath) {
            Path trainedData = Path.of(datapath, nativeLanguage + ".traineddata");
            if (!Files.isRegularFile(trainedData)) {
                throw new OcrException("Missing Tesseract language data: " + trainedData, null);
            }
        }

        TesseractHandle handle = NativeTesseractHandle.open(
                customDatapath ? datapath : null,
                nativeLanguage,
                ocrProperties.getPageSegMode()
        );
        return new TesseractOcrEngine(nativeLanguage, handle);
    }
}
