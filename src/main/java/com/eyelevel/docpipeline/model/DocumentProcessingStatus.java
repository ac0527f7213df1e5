package com.eyelevel.docpipeline.model;

/**
 * Pipeline stage recorded on a {@link Document}.
 */
public enum DocumentProcessingStatus {
    PENDING,
    PROCESSING,
    OCR_IN_PROGRESS,
    OCR_COMPLETE,
    EMBEDDING_IN_PROGRESS,
    COMPLETE,
    FAILED
}
