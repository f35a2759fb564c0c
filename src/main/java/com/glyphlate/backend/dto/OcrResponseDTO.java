package com.glyphlate.backend.dto;

import java.util.List;

import com.glyphlate.backend.services.ocr.OcrResult;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class OcrResponseDTO {

    private String text;
    private List<TextBlockDTO> blocks;
    private double confidence;
    private String language;

    public static OcrResponseDTO from(OcrResult result) {
        if (result == null) {
            return null;
        }
        return new OcrResponseDTO(
                result.text(),
                result.blocks().stream().map(TextBlockDTO::from).toList(),
                result.confidence(),
                result.language()
        );
    }
}
