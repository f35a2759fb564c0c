package com.glyphlate.backend.controllers;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.glyphlate.backend.dto.ApiResponse;
import com.glyphlate.backend.dto.ImageTranslateResponseDTO;
import com.glyphlate.backend.dto.OcrResponseDTO;
import com.glyphlate.backend.exceptions.BadRequestException;
import com.glyphlate.backend.exceptions.ImageProcessingException;
import com.glyphlate.backend.services.image.ImageTranslateOptions;
import com.glyphlate.backend.services.image.ImageTranslateResult;
import com.glyphlate.backend.services.image.ImageTranslationService;
import com.glyphlate.backend.services.image.OutputFormat;
import com.glyphlate.backend.services.language.LanguageCodes;
import com.glyphlate.backend.services.ocr.OcrResult;
import com.glyphlate.backend.services.render.RenderOptions;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/image")
@RequiredArgsConstructor
@Slf4j
public class ImageController {

    static final Set<String> ALLOWED_MIME_TYPES = Set.of(
            "image/jpeg",
            "image/png",
            "image/gif",
            "image/webp",
            "image/bmp"
    );

    private final ImageTranslationService imageTranslationService;

    /**
     * {@code format=image} (default) streams the translated PNG with the OCR summary in headers;
     * {@code format=json} wraps everything in {@link ApiResponse}; {@code format=svg} returns an
     * overlay document.
     */
    @PostMapping("/translate")
    public ResponseEntity<?> translate(
            @RequestParam("image") MultipartFile image,
            @RequestParam(value = "from", defaultValue = LanguageCodes.AUTO) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "format", defaultValue = "image") String format,
            @RequestParam(value = "backgroundColor", required = false) String backgroundColor,
            @RequestParam(value = "textColor", required = false) String textColor,
            @RequestParam(value = "fontFamily", required = false) String fontFamily,
            @RequestParam(value = "padding", required = false) Integer padding
    ) {
        byte[] bytes = readImage(image);

        if (LanguageCodes.isAuto(to)) {
            throw new BadRequestException("Target language 'to' is required");
        }
        if (padding != null && padding < 0) {
            throw new BadRequestException("padding must be >= 0");
        }

        log.info("[ImagePipeline] Translate request: {} bytes, {} -> {}, format={}", bytes.length, from, to, format);

        String responseFormat = format.trim().toLowerCase(Locale.ROOT);
        boolean json = "json".equals(responseFormat);
        OutputFormat outputFormat = json ? OutputFormat.PNG : OutputFormat.parse(responseFormat);

        ImageTranslateOptions options = new ImageTranslateOptions(
                LanguageCodes.normalize(from),
                LanguageCodes.normalize(to),
                new RenderOptions(backgroundColor, textColor, fontFamily, padding),
                outputFormat
        );

        ImageTranslateResult result = imageTranslationService.translate(bytes, options);

        if (json) {
            return ResponseEntity.ok(ApiResponse.success(ImageTranslateResponseDTO.from(result), "Image translated"));
        }

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(result.mediaType()))
                .header("X-OCR-Confidence", String.valueOf(result.ocrResult().confidence()))
                .header("X-Detected-Language", result.ocrResult().language())
                .header("X-Translations-Count", String.valueOf(result.translations().size()))
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(result.image());
    }

    @PostMapping("/ocr")
    public ResponseEntity<ApiResponse<OcrResponseDTO>> ocr(
            @RequestParam("image") MultipartFile image,
            @RequestParam(value = "lang", defaultValue = LanguageCodes.AUTO) String lang
    ) {
        byte[] bytes = readImage(image);
        log.info("[ImagePipeline] OCR request: {} bytes, lang={}", bytes.length, lang);

        OcrResult result = imageTranslationService.extractText(bytes, LanguageCodes.normalize(lang));
        return ResponseEntity.ok(ApiResponse.success(OcrResponseDTO.from(result), "Text extracted"));
    }

    private static byte[] readImage(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            throw new BadRequestException("No image provided");
        }

        String contentType = image.getContentType();
        if (contentType == null || !ALLOWED_MIME_TYPES.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new BadRequestException("Unsupported image type: " + contentType
                    + ". Allowed: jpeg, png, gif, webp, bmp");
        }

        try {
            return image.getBytes();
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to read uploaded image", e);
        }
    }
}
