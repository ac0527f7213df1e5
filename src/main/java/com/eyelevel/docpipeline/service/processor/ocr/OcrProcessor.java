package com.eyelevel.docpipeline.service.processor.ocr;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.common.json.JsonSerializer;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.DocumentProcessingStatus;
import com.eyelevel.docpipeline.model.DocumentStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.service.error.ErrorClassifier;
import com.eyelevel.docpipeline.service.processor.AbstractJobProcessor;
import com.eyelevel.docpipeline.service.processor.JobExecutionContext;
import com.eyelevel.docpipeline.service.processor.embedding.EmbeddingOptions;
import com.eyelevel.docpipeline.service.processor.embedding.EmbeddingService;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts text, tables and form fields with Textract and stores them on the document.
 * <p>
 * Small images are analyzed synchronously. PDFs, large files and callers that force it use the asynchronous
 * Textract API, whose job id is kept in the job's input parameters while it is polled.
 */
@Slf4j
@Component
public class OcrProcessor extends AbstractJobProcessor {

    private static final String OCR_VERSION = "1.0";
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final OcrEngine ocrEngine;
    private final OcrJobPoller poller;
    private final EmbeddingService embeddingService;
    private final PipelineProperties properties;
    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;

    public OcrProcessor(ProcessingStore store, ErrorClassifier errorClassifier, Clock clock,
                        OcrEngine ocrEngine, OcrJobPoller poller, EmbeddingService embeddingService,
                        PipelineProperties properties,
                        @Qualifier("jacksonJsonParser") JsonParser jsonParser,
                        @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer) {
        super(store, errorClassifier, clock);
        this.ocrEngine = ocrEngine;
        this.poller = poller;
        this.embeddingService = embeddingService;
        this.properties = properties;
        this.jsonParser = jsonParser;
        this.jsonSerializer = jsonSerializer;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.OCR);
    }

    @Override
    protected DocumentProcessingStatus inProgressStatus(JobType jobType) {
        return DocumentProcessingStatus.OCR_IN_PROGRESS;
    }

    @Override
    protected Map<String, Object> execute(JobExecutionContext context) throws Exception {
        final String contextInfo = context.getContextInfo();
        long startTime = clock.millis();
        context.reportProgress(5);

        Document document = requireDocument(context.getDocumentId());
        validate(document);
        context.reportProgress(10);

        OcrOptions options = jsonParser.convert(context.getOptions(), OcrOptions.class);
        String s3Key = context.getS3Key() != null ? context.getS3Key() : document.getS3Key();
        boolean useAsync = shouldUseAsyncProcessing(document.getMimeType(), document.getSizeBytes(), options);

        String textractJobId = null;
        OcrResult result;
        if (useAsync) {
            log.info("[{}] Using asynchronous Textract analysis.", contextInfo);
            context.reportProgress(15);
            textractJobId = ocrEngine.startDocumentAnalysis(s3Key, options.getFeatures());
            final String externalJobId = textractJobId;
            store.updateJob(context.getJobId(), job -> {
                Map<String, Object> params = new HashMap<>(job.getInputParams());
                params.put("textractJobId", externalJobId);
                job.setInputParams(params);
            });
            context.reportProgress(20);
            result = poller.awaitCompletion(textractJobId, context);
        } else {
            log.info("[{}] Using synchronous Textract analysis.", contextInfo);
            context.reportProgress(20);
            result = ocrEngine.analyzeDocument(s3Key, options.getFeatures());
        }
        context.reportProgress(70);

        long processingTimeMs = clock.millis() - startTime;
        context.reportProgress(80);
        saveResults(document.getId(), result, options, textractJobId, processingTimeMs);
        context.reportProgress(85);

        boolean embeddingGenerated = false;
        if (options.isGenerateEmbeddings() && !result.getText().isBlank() && embeddingService.isAvailable()) {
            try {
                embeddingService.generateAndStoreEmbedding(document.getId(), result.getText(), new EmbeddingOptions());
                embeddingGenerated = true;
            } catch (RuntimeException e) {
                log.warn("[{}] Inline embedding failed, OCR result kept: {}", contextInfo, e.getMessage());
            }
        }
        context.reportProgress(95);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("textLength", result.getText().length());
        output.put("wordCount", result.getWordCount());
        output.put("pageCount", result.getPageCount());
        output.put("tableCount", result.getTables().size());
        output.put("formFieldCount", result.getFormFields().size());
        output.put("signatureCount", result.getSignatureCount());
        output.put("confidence", result.getConfidence());
        output.put("processingTimeMs", processingTimeMs);
        output.put("embeddingGenerated", embeddingGenerated);
        output.put("textractJobId", textractJobId);
        output.put("usedAsyncProcessing", useAsync);
        return output;
    }

    /**
     * Asynchronous analysis is required for PDFs and files above the threshold, or when the caller forces it.
     */
    boolean shouldUseAsyncProcessing(String mimeType, long sizeBytes, OcrOptions options) {
        return options.isForceAsync()
                || "application/pdf".equals(mimeType)
                || sizeBytes > properties.getOcr().getAsyncThresholdBytes();
    }

    private void validate(Document document) {
        PipelineProperties.Ocr config = properties.getOcr();
        if (!config.getSupportedMimeTypes().contains(document.getMimeType())) {
            throw new ProcessingException("Unsupported file type for OCR: " + document.getMimeType()
                    + ". Supported types: PDF, JPEG, PNG, TIFF");
        }
        if (document.getSizeBytes() > config.getMaxFileSizeBytes()) {
            throw new ProcessingException(String.format("Unsupported file size for OCR: %dMB. Maximum: %dMB",
                    document.getSizeBytes() / BYTES_PER_MB, config.getMaxFileSizeBytes() / BYTES_PER_MB));
        }
    }

    private void saveResults(String documentId, OcrResult result, OcrOptions options, String textractJobId,
                             long processingTimeMs) {
        Map<String, Object> ocr = new LinkedHashMap<>();
        ocr.put("ocrProcessedAt", Instant.now(clock).toString());
        ocr.put("ocrVersion", OCR_VERSION);
        ocr.put("pageCount", result.getPageCount());
        ocr.put("wordCount", result.getWordCount());
        ocr.put("characterCount", result.getText().length());
        ocr.put("confidence", result.getConfidence());
        ocr.put("tableCount", result.getTables().size());
        ocr.put("formFieldCount", result.getFormFields().size());
        ocr.put("signatureCount", result.getSignatureCount());
        ocr.put("processingTimeMs", processingTimeMs);
        ocr.put("featureTypes", List.copyOf(options.getFeatures()));
        ocr.put("textractJobId", textractJobId);
        ocr.put("tables", result.getTables().stream().map(jsonSerializer::toMap).toList());
        ocr.put("formFields", result.getFormFields().stream().map(jsonSerializer::toMap).toList());

        store.updateDocument(documentId, document -> {
            document.setExtractedText(result.getText());
            document.putMetadata("ocr", ocr);
            document.setProcessingStatus(DocumentProcessingStatus.OCR_COMPLETE);
            document.setStatus(DocumentStatus.READY);
        });
    }
}
