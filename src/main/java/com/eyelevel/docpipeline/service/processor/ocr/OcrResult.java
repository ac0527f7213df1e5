package com.eyelevel.docpipeline.service.processor.ocr;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed output of one Textract analysis.
 */
@Value
@Builder
public class OcrResult {
    String text;
    int pageCount;
    int wordCount;
    double confidence;
    @Builder.Default
    List<OcrTable> tables = List.of();
    @Builder.Default
    List<OcrFormField> formFields = List.of();
    int signatureCount;
}
