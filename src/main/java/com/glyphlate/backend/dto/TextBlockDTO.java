package com.glyphlate.backend.dto;

import com.glyphlate.backend.services.ocr.BoundingBox;
import com.glyphlate.backend.services.ocr.TextBlock;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TextBlockDTO {

    private String text;
    private double confidence;
    private BoundingBox bbox;
    private BoundingBox baseline;
    private int fontSize;
    private int lineHeight;

    public static TextBlockDTO from(TextBlock block) {
        return new TextBlockDTO(
                block.text(),
                block.confidence(),
                block.bbox(),
                block.baseline(),
                block.fontSize(),
                block.lineHeight()
        );
    }
}
