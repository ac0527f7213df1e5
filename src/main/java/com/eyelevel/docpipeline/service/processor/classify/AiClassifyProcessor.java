package com.eyelevel.docpipeline.service.processor.classify;

import com.eyelevel.docpipeline.common.apiclient.openai.OpenAiApiClient;
import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.config.PipelineProperties;
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
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies a document with a chat model and optionally extracts named entities.
 * <p>
 * The prompt uses the extracted text when present and falls back to the file name alone.
 */
@Slf4j
@Component
public class AiClassifyProcessor extends AbstractJobProcessor {

    private final OpenAiApiClient openAiApiClient;
    private final PipelineProperties properties;
    private final JsonParser jsonParser;
    private final ClassificationResponseParser responseParser;

    public AiClassifyProcessor(ProcessingStore store, ErrorClassifier errorClassifier, Clock clock,
                               OpenAiApiClient openAiApiClient, PipelineProperties properties,
                               @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        super(store, errorClassifier, clock);
        this.openAiApiClient = openAiApiClient;
        this.properties = properties;
        this.jsonParser = jsonParser;
        this.responseParser = new ClassificationResponseParser(jsonParser);
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.AI_CLASSIFY);
    }

    @Override
    protected Map<String, Object> execute(JobExecutionContext context) {
        final String contextInfo = context.getContextInfo();
        context.reportProgress(10);

        if (!openAiApiClient.isConfigured()) {
            log.warn("[{}] OpenAI API key not configured. Skipping classification.", contextInfo);
            Map<String, Object> skipped = new LinkedHashMap<>();
            skipped.put("category", "Unknown");
            skipped.put("confidence", 0);
            skipped.put("tags", List.of());
            skipped.put("skipped", true);
            return skipped;
        }

        Document document = requireDocument(context.getDocumentId());
        ClassifyOptions options = jsonParser.convert(context.getOptions(), ClassifyOptions.class);
        PipelineProperties.AiClassify config = properties.getAiClassify();
        List<String> categories = options.getCategories() != null && !options.getCategories().isEmpty()
                ? options.getCategories() : config.getCategories();
        context.reportProgress(20);

        String content = truncate(document.getExtractedText() != null ? document.getExtractedText() : "",
                config.getMaxTextLength());
        String prompt = ClassificationPrompts.classification(document.getName(), content, categories);
        String answer = openAiApiClient.complete(config.getModel(), prompt, config.getTemperature(),
                config.getMaxResponseTokens());
        DocumentClassification classification = responseParser.parseClassification(answer);
        log.info("[{}] Classified as '{}' with confidence {}.", contextInfo, classification.category(),
                 classification.confidence());
        context.reportProgress(60);

        Map<String, List<String>> entities = null;
        if (options.isExtractEntities() && !content.isBlank()) {
            String entityAnswer = openAiApiClient.complete(config.getModel(), ClassificationPrompts.entities(content),
                    config.getTemperature(), config.getMaxResponseTokens());
            entities = responseParser.parseEntities(entityAnswer);
        }
        context.reportProgress(80);

        Map<String, Object> metadata = classificationMap(classification);
        if (entities != null) {
            metadata.put("entities", entities);
        }
        metadata.put("classifiedAt", Instant.now(clock).toString());
        metadata.put("model", config.getModel());
        store.updateDocument(document.getId(), doc -> {
            doc.putMetadata("aiClassification", metadata);
            doc.setProcessingStatus(DocumentProcessingStatus.COMPLETE);
        });
        context.reportProgress(90);

        Map<String, Object> result = classificationMap(classification);
        if (entities != null) {
            result.put("entities", entities);
        }
        return result;
    }

    private static Map<String, Object> classificationMap(DocumentClassification classification) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("category", classification.category());
        map.put("confidence", classification.confidence());
        map.put("language", classification.language());
        map.put("tags", classification.tags());
        map.put("summary", classification.summary());
        return map;
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
