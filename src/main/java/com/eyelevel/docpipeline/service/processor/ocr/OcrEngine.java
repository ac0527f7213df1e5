package com.eyelevel.docpipeline.service.processor.ocr;

import java.util.List;
import java.util.Optional;

/**
 * Text extraction backend for objects already in the document bucket.
 */
public interface OcrEngine {

    /**
     * Analyzes a single-page class document in one blocking call.
     */
    OcrResult analyzeDocument(String s3Key, List<String> features);

    /**
     * Starts an asynchronous analysis.
     *
     * @return the external job id to poll.
     */
    String startDocumentAnalysis(String s3Key, List<String> features);

    /**
     * @return the result once the analysis succeeded, empty while it is still running.
     * @throws com.eyelevel.docpipeline.exception.ProcessingException if the analysis failed.
     */
    Optional<OcrResult> getDocumentAnalysis(String externalJobId);
}
