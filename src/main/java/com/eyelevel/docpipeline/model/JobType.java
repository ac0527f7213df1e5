package com.eyelevel.docpipeline.model;

/**
 * The fixed set of work a {@link ProcessingJob} can perform against a document.
 */
public enum JobType {
    OCR,
    THUMBNAIL,
    EMBEDDING,
    AI_CLASSIFY,
    PDF_SPLIT,
    PDF_MERGE,
    PDF_WATERMARK,
    PDF_COMPRESS,
    PDF_EXTRACT_PAGES,
    PDF_RENDER_PAGE,
    PDF_METADATA;

    /**
     * @return true for the PDF sub-operations that share the PDF queue.
     */
    public boolean isPdfOperation() {
        return name().startsWith("PDF_");
    }
}
