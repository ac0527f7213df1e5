package com.eyelevel.docpipeline.service.processor.classify;

import lombok.Data;

import java.util.List;

/**
 * Options of an AI_CLASSIFY job. Null categories fall back to the configured list.
 */
@Data
public class ClassifyOptions {
    private List<String> categories;
    private boolean extractEntities;
}
