package com.glyphlate.backend.dto;

import java.util.Base64;
import java.util.List;

import com.glyphlate.backend.services.image.ImageTranslateResult;
import com.glyphlate.backend.services.image.TranslationPair;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ImageTranslateResponseDTO {

    /** Tesseract language the text was recognized with (e.g. "eng"). */
    private String detectedLanguage;
    /** Source language the translation used (e.g. "en"). */
    private String sourceLanguage;
    private double confidence;
    private List<TranslationPair> translations;
    private String mediaType;
    /** Base64 of the output image. */
    private String image;

    public static ImageTranslateResponseDTO from(ImageTranslateResult result) {
        return new ImageTranslateResponseDTO(
                result.ocrResult().language(),
                result.sourceLanguage(),
                result.ocrResult().confidence(),
                result.translations(),
                result.mediaType(),
                Base64.getEncoder().encodeToString(result.image())
        );
    }
}
