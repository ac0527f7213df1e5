package com.eyelevel.docpipeline.service.processor.embedding;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DocumentEmbedding {
    String documentId;
    String model;
    List<Double> vector;
    int tokenCount;
    int totalChunks;
    boolean wasTruncated;

    public int getDimensions() {
        return vector.size();
    }
}
