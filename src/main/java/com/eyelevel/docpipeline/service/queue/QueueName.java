package com.eyelevel.docpipeline.service.queue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The named delivery channels of the pipeline.
 */
@Getter
@RequiredArgsConstructor
public enum QueueName {
    OCR("ocr-queue", "Text extraction with AWS Textract"),
    PDF("pdf-queue", "PDF split, merge, watermark, compress, page extraction, rendering and metadata"),
    THUMBNAIL("thumbnail-queue", "Thumbnail generation for images and PDFs"),
    EMBEDDING("embedding-queue", "Vector embeddings for semantic search"),
    AI_CLASSIFY("ai-classify-queue", "AI document classification and entity extraction"),
    /**
     * The single queue of the older design. Never enqueued to; drained and consulted on lookups and removals.
     */
    LEGACY("document-processing", "Legacy document processing queue");

    private final String value;
    private final String description;

    public static final List<QueueName> PRIMARY = List.of(OCR, PDF, THUMBNAIL, EMBEDDING, AI_CLASSIFY);

    public static Optional<QueueName> fromValue(String value) {
        return Arrays.stream(values()).filter(name -> name.value.equals(value)).findFirst();
    }
}
