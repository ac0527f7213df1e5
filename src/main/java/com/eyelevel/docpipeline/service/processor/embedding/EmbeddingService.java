package com.eyelevel.docpipeline.service.processor.embedding;

import com.eyelevel.docpipeline.common.apiclient.openai.OpenAiApiClient;
import com.eyelevel.docpipeline.common.apiclient.openai.model.EmbeddingResponse;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Produces one embedding per document and stores it on the document.
 * <p>
 * Text within the model's budget is embedded directly. Longer text is either chunked, embedded in batches
 * and aggregated, or truncated at a word boundary when aggregation is off.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    private final OpenAiApiClient openAiApiClient;
    private final ProcessingStore store;
    private final PipelineProperties properties;

    public boolean isAvailable() {
        return openAiApiClient.isConfigured();
    }

    public DocumentEmbedding generateAndStoreEmbedding(String documentId, String text, EmbeddingOptions options) {
        DocumentEmbedding embedding = generateEmbedding(documentId, text, options);
        store.updateDocument(documentId, document -> document.setContentVector(embedding.getVector()));
        log.info("Stored {}-dimension embedding for document {} ({} chunk(s), truncated: {}).",
                 embedding.getDimensions(), documentId, embedding.getTotalChunks(), embedding.isWasTruncated());
        return embedding;
    }

    public DocumentEmbedding generateEmbedding(String documentId, String text, EmbeddingOptions options) {
        PipelineProperties.Embedding defaults = properties.getEmbedding();
        String model = options.getModel() != null ? options.getModel() : defaults.getModel();
        int maxTokens = options.getMaxTokensPerChunk() != null ? options.getMaxTokensPerChunk() : defaults.getMaxTokens();
        Integer dimensions = model.startsWith("text-embedding-3")
                ? (options.getDimensions() != null ? options.getDimensions() : defaults.getDimensions())
                : null;

        int estimatedTokens = TextChunker.estimateTokens(text);
        if (estimatedTokens <= maxTokens) {
            List<Double> vector = embedBatch(model, List.of(text), dimensions).get(0);
            return build(documentId, model, vector, estimatedTokens, 1, false);
        }

        if (options.isAggregateChunks()) {
            List<String> chunks = TextChunker.splitIntoChunks(text, maxTokens);
            log.debug("Document {} exceeds {} tokens; embedding {} chunks.", documentId, maxTokens, chunks.size());
            List<List<Double>> vectors = embedBatch(model, chunks, dimensions);
            int tokens = chunks.stream().mapToInt(TextChunker::estimateTokens).sum();
            return build(documentId, model, EmbeddingVectors.averageAndNormalize(vectors), tokens, chunks.size(), false);
        }

        String truncated = TextChunker.truncateToTokenLimit(text, maxTokens);
        List<Double> vector = embedBatch(model, List.of(truncated), dimensions).get(0);
        return build(documentId, model, vector, TextChunker.estimateTokens(truncated), 1, true);
    }

    /**
     * Embeds the inputs in order, in as many calls as the batch size requires.
     */
    List<List<Double>> embedBatch(String model, List<String> inputs, Integer dimensions) {
        int batchSize = properties.getEmbedding().getBatchSize();
        List<List<Double>> vectors = new ArrayList<>(inputs.size());
        for (int start = 0; start < inputs.size(); start += batchSize) {
            List<String> batch = inputs.subList(start, Math.min(inputs.size(), start + batchSize));
            EmbeddingResponse response = openAiApiClient.createEmbeddings(model, batch, dimensions);
            if (response.getData() == null || response.getData().size() != batch.size()) {
                throw new ProcessingException("Embedding response contained "
                        + (response.getData() == null ? 0 : response.getData().size())
                        + " vectors for " + batch.size() + " inputs");
            }
            response.getData().stream()
                    .sorted(Comparator.comparingInt(EmbeddingResponse.EmbeddingData::getIndex))
                    .forEach(data -> vectors.add(data.getEmbedding()));
        }
        return vectors;
    }

    private static DocumentEmbedding build(String documentId, String model, List<Double> vector, int tokens,
                                           int chunks, boolean truncated) {
        return DocumentEmbedding.builder()
                .documentId(documentId)
                .model(model)
                .vector(vector)
                .tokenCount(tokens)
                .totalChunks(chunks)
                .wasTruncated(truncated)
                .build();
    }
}
