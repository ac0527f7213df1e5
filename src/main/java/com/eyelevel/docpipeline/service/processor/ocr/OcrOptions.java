package com.eyelevel.docpipeline.service.processor.ocr;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Options of an OCR job.
 */
@Data
public class OcrOptions {
    /**
     * Textract analysis features, e.g. TABLES, FORMS, SIGNATURES.
     */
    private List<String> features = new ArrayList<>(List.of("TABLES", "FORMS"));
    private boolean forceAsync;
    /**
     * Generate the embedding inline once text is extracted, instead of waiting for the chained job.
     */
    private boolean generateEmbeddings = true;
}
