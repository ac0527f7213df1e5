package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.exception.ProcessingException;

import java.util.Locale;

/**
 * Where watermark text is placed on a page, with a 50pt margin from the edges.
 */
public enum WatermarkPosition {
    CENTER,
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_LEFT,
    BOTTOM_RIGHT,
    DIAGONAL;

    private static final float MARGIN = 50;

    public static WatermarkPosition fromValue(String value) {
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProcessingException("Invalid watermark position: " + value, e);
        }
    }

    /**
     * @return the text origin {x, y} for a page of the given size.
     */
    public float[] origin(float pageWidth, float pageHeight, float textWidth, float fontSize) {
        return switch (this) {
            case TOP_LEFT -> new float[]{MARGIN, pageHeight - MARGIN - fontSize};
            case TOP_RIGHT -> new float[]{pageWidth - textWidth - MARGIN, pageHeight - MARGIN - fontSize};
            case BOTTOM_LEFT -> new float[]{MARGIN, MARGIN};
            case BOTTOM_RIGHT -> new float[]{pageWidth - textWidth - MARGIN, MARGIN};
            case DIAGONAL -> new float[]{pageWidth / 2 - textWidth / 2, pageHeight / 2};
            case CENTER -> new float[]{pageWidth / 2 - textWidth / 2, pageHeight / 2 - fontSize / 2};
        };
    }
}
