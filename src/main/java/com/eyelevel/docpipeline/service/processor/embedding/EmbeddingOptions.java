package com.eyelevel.docpipeline.service.processor.embedding;

import lombok.Data;

/**
 * Options of an EMBEDDING job. A null model falls back to the configured default.
 */
@Data
public class EmbeddingOptions {
    private String model;
    private Integer maxTokensPerChunk;
    private boolean aggregateChunks = true;
    private Integer dimensions;
}
