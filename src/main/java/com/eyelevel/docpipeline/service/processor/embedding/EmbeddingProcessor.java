package com.eyelevel.docpipeline.service.processor.embedding;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.DocumentProcessingStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.service.error.ErrorClassifier;
import com.eyelevel.docpipeline.service.processor.AbstractJobProcessor;
import com.eyelevel.docpipeline.service.processor.JobExecutionContext;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Generates the document's content embedding from its extracted text.
 */
@Slf4j
@Component
public class EmbeddingProcessor extends AbstractJobProcessor {

    private final EmbeddingService embeddingService;
    private final JsonParser jsonParser;

    public EmbeddingProcessor(ProcessingStore store, ErrorClassifier errorClassifier, Clock clock,
                              EmbeddingService embeddingService, @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        super(store, errorClassifier, clock);
        this.embeddingService = embeddingService;
        this.jsonParser = jsonParser;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.EMBEDDING);
    }

    @Override
    protected DocumentProcessingStatus inProgressStatus(JobType jobType) {
        return DocumentProcessingStatus.EMBEDDING_IN_PROGRESS;
    }

    @Override
    protected Map<String, Object> execute(JobExecutionContext context) {
        context.reportProgress(10);
        Document document = requireDocument(context.getDocumentId());
        String text = document.getExtractedText();
        if (text == null || text.isBlank()) {
            throw new ProcessingException("Document has no extracted text. Run OCR first.");
        }
        context.reportProgress(30);

        if (!embeddingService.isAvailable()) {
            log.warn("[{}] OpenAI API key not configured. Skipping embedding.", context.getContextInfo());
            store.updateDocument(document.getId(),
                    doc -> doc.setProcessingStatus(DocumentProcessingStatus.COMPLETE));
            Map<String, Object> skipped = new LinkedHashMap<>();
            skipped.put("skipped", true);
            skipped.put("reason", "OpenAI API key not configured");
            skipped.put("embeddingDimensions", 0);
            skipped.put("textLength", text.length());
            return skipped;
        }

        EmbeddingOptions options = jsonParser.convert(context.getOptions(), EmbeddingOptions.class);
        context.reportProgress(50);
        DocumentEmbedding embedding = embeddingService.generateAndStoreEmbedding(document.getId(), text, options);
        context.reportProgress(90);

        store.updateDocument(document.getId(), doc -> doc.setProcessingStatus(DocumentProcessingStatus.COMPLETE));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("embeddingDimensions", embedding.getDimensions());
        result.put("tokensUsed", embedding.getTokenCount());
        result.put("chunksProcessed", embedding.getTotalChunks());
        result.put("textLength", text.length());
        result.put("model", embedding.getModel());
        result.put("wasTruncated", embedding.isWasTruncated());
        return result;
    }
}
