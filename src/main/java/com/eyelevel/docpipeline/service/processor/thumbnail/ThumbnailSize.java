package com.eyelevel.docpipeline.service.processor.thumbnail;

import com.eyelevel.docpipeline.exception.ProcessingException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Bounding box edge, in pixels, of each thumbnail size.
 */
@Getter
@RequiredArgsConstructor
public enum ThumbnailSize {
    SMALL(100),
    MEDIUM(300),
    LARGE(600);

    private final int maxDimension;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ThumbnailSize fromLabel(String label) {
        for (ThumbnailSize size : values()) {
            if (size.label().equalsIgnoreCase(label)) {
                return size;
            }
        }
        throw new ProcessingException("Invalid thumbnail size: " + label + ". Expected small, medium or large");
    }
}
