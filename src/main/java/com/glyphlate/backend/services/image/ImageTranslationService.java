package com.glyphlate.backend.services.image;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.springframework.stereotype.Service;

import com.glyphlate.backend.services.language.LanguageCodes;
import com.glyphlate.backend.services.language.LanguageDetectionService;
import com.glyphlate.backend.services.ocr.OcrLanguageMapper;
import com.glyphlate.backend.services.ocr.OcrProperties;
import com.glyphlate.backend.services.ocr.OcrResult;
import com.glyphlate.backend.services.ocr.RecognitionService;
import com.glyphlate.backend.services.render.SvgOverlayRenderer;
import com.glyphlate.backend.services.render.TranslatedImageRenderer;
import com.glyphlate.backend.services.translation.BatchTranslator;
import com.glyphlate.backend.services.translation.TranslatedBlock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Image translation pipeline: preprocess, recognize (detecting the source language when asked),
 * translate the recognized blocks and render them over the original image.
 *
 * <p>With {@code fromLang = "auto"} a first pass runs with the configured default OCR language.
 * The detected language only triggers a second pass when it maps to a different Tesseract
 * language than the default one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageTranslationService {

    static final String EMPTY_TEXT_LANGUAGE = "en";

    private static final String SVG_MEDIA_TYPE = "image/svg+xml";

    private final ImageCodec imageCodec;
    private final ImagePreprocessor preprocessor;
    private final RecognitionService recognitionService;
    private final LanguageDetectionService languageDetectionService;
    private final BatchTranslator batchTranslator;
    private final TranslatedImageRenderer renderer;
    private final SvgOverlayRenderer svgOverlayRenderer;
    private final OcrProperties ocrProperties;

    public ImageTranslateResult translate(byte[] imageBytes, ImageTranslateOptions options) {
        String toLang = options.toLang();
        if (LanguageCodes.isAuto(toLang)) {
            throw new IllegalArgumentException("Target language is required");
        }

        long startMs = System.currentTimeMillis();

        BufferedImage original = imageCodec.decode(imageBytes);
        PreprocessedImage processed = preprocessor.preprocess(original);

        log.info("[ImagePipeline] Translating {}x{} image {} -> {}",
                original.getWidth(), original.getHeight(), options.fromLang(), toLang);

        ResolvedRecognition recognition = recognize(processed.image(), options.fromLang());
        OcrResult ocrResult = recognition.result();
        String fromLang = recognition.language();

        if (ocrResult.blocks().isEmpty()) {
            log.info("[ImagePipeline] No text found, returning original image");
            if (options.format() == OutputFormat.SVG) {
                String svg = svgOverlayRenderer.render(original.getWidth(), original.getHeight(), List.of(), options.renderOptions());
                return new ImageTranslateResult(svg.getBytes(StandardCharsets.UTF_8), SVG_MEDIA_TYPE, fromLang, ocrResult, List.of());
            }
            return new ImageTranslateResult(imageBytes, imageCodec.mediaTypeOf(imageBytes), fromLang, ocrResult, List.of());
        }

        List<TranslatedBlock> translatedBlocks =
                batchTranslator.translateBlocks(ocrResult.blocks(), fromLang, toLang, processed.scale());

        List<TranslationPair> translations = translatedBlocks.stream()
                .map(block -> new TranslationPair(block.text(), block.translatedText()))
                .toList();

        ImageTranslateResult result;
        if (options.format() == OutputFormat.SVG) {
            String svg = svgOverlayRenderer.render(original.getWidth(), original.getHeight(), translatedBlocks, options.renderOptions());
            result = new ImageTranslateResult(svg.getBytes(StandardCharsets.UTF_8), SVG_MEDIA_TYPE, fromLang, ocrResult, translations);
        } else {
            byte[] rendered = renderer.render(original, translatedBlocks, options.renderOptions());
            result = new ImageTranslateResult(rendered, ImageCodec.OUTPUT_MEDIA_TYPE, fromLang, ocrResult, translations);
        }

        log.info("[ImagePipeline] Completed: blocks={} from={} to={} elapsedMs={}",
                translations.size(), fromLang, toLang, System.currentTimeMillis() - startMs);
        return result;
    }

    /**
     * Recognition only. Runs on the decoded upload without downsampling, so block geometry is in
     * the coordinates of the uploaded image.
     */
    public OcrResult extractText(byte[] imageBytes, String language) {
        BufferedImage image = imageCodec.decode(imageBytes);
        return recognize(image, language).result();
    }

    private ResolvedRecognition recognize(BufferedImage image, String fromLang) {
        if (!LanguageCodes.isAuto(fromLang)) {
            return new ResolvedRecognition(recognitionService.recognize(image, fromLang), fromLang);
        }

        String defaultLanguage = ocrProperties.getDefaultLanguage();
        OcrResult first = recognitionService.recognize(image, defaultLanguage);

        if (!first.hasText()) {
            log.info("[ImagePipeline] Empty transcription, assuming source language {}", EMPTY_TEXT_LANGUAGE);
            return new ResolvedRecognition(first, EMPTY_TEXT_LANGUAGE);
        }

        String detected = detect(first.text(), defaultLanguage);

        if (OcrLanguageMapper.toNative(detected).equals(OcrLanguageMapper.toNative(defaultLanguage))) {
            log.debug("[ImagePipeline] Detected {} matches default OCR language, reusing first pass", detected);
            return new ResolvedRecognition(first, detected);
        }

        log.info("[ImagePipeline] Detected {}, re-running OCR", detected);
        return new ResolvedRecognition(recognitionService.recognize(image, detected), detected);
    }

    private String detect(String text, String defaultLanguage) {
        try {
            String detected = languageDetectionService.detectLanguage(text);
            if (LanguageCodes.isAuto(detected)) {
                return defaultLanguage;
            }
            detected = LanguageCodes.normalize(detected);
            log.info("[ImagePipeline] Detected source language: {}", detected);
            return detected;
        } catch (RuntimeException e) {
            log.warn("[ImagePipeline] Language detection failed, keeping {}: {}", defaultLanguage, e.getMessage());
            return defaultLanguage;
        }
    }

    private record ResolvedRecognition(OcrResult result, String language) {
    }
}
