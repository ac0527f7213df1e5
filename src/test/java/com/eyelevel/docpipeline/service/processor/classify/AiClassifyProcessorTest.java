package com.eyelevel.docpipeline.service.processor.classify;

import com.eyelevel.docpipeline.common.apiclient.openai.OpenAiApiClient;
import com.eyelevel.docpipeline.common.json.jackson.JacksonJsonParser;
import com.eyelevel.docpipeline.common.time.MutableClock;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.DocumentProcessingStatus;
import com.eyelevel.docpipeline.model.JobStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.model.ProcessingJob;
import com.eyelevel.docpipeline.service.error.ErrorClassifier;
import com.eyelevel.docpipeline.service.processor.JobExecutionContext;
import com.eyelevel.docpipeline.service.queue.JobPayload;
import com.eyelevel.docpipeline.service.queue.QueueJob;
import com.eyelevel.docpipeline.service.queue.QueueJobState;
import com.eyelevel.docpipeline.service.store.InMemoryProcessingStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiClassifyProcessorTest {

    private static final String CLASSIFICATION = """
            ```json
            {"category": "Invoice", "confidence": 0.92, "language": "en",
             "tags": ["billing", "acme"], "summary": "Invoice from ACME."}
            ```""";

    @Mock
    private OpenAiApiClient openAiApiClient;

    private final InMemoryProcessingStore store = new InMemoryProcessingStore();
    private final PipelineProperties properties = new PipelineProperties();
    private AiClassifyProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new AiClassifyProcessor(store, new ErrorClassifier(), MutableClock.startingAt("2026-05-04T07:30:00Z"),
                                            openAiApiClient, properties, new JacksonJsonParser(new ObjectMapper()));

        Document document = new Document();
        document.setId("doc-1");
        document.setOrganizationId("org-1");
        document.setName("acme-invoice.pdf");
        document.setExtractedText("ACME Corp invoice 42, total 1,200 EUR");
        store.saveDocument(document);
    }

    @Test
    void classificationIsStoredOnTheDocument() throws Exception {
        ProcessingJob job = saveJob(Map.of());
        when(openAiApiClient.isConfigured()).thenReturn(true);
        when(openAiApiClient.complete(eq("gpt-4-turbo-preview"), anyString(), eq(0.3), eq(500)))
                .thenReturn(CLASSIFICATION);

        Map<String, Object> output = processor.process(contextFor(job));

        assertEquals("Invoice", output.get("category"));
        assertEquals(0.92, output.get("confidence"));
        assertEquals(List.of("billing", "acme"), output.get("tags"));
        assertFalse(output.containsKey("entities"));

        Document document = store.getDocument("doc-1").orElseThrow();
        assertEquals(DocumentProcessingStatus.COMPLETE, document.getProcessingStatus());
        Map<?, ?> stored = (Map<?, ?>) document.getMetadata().get("aiClassification");
        assertEquals("Invoice", stored.get("category"));
        assertEquals("2026-05-04T07:30:00Z", stored.get("classifiedAt"));
        assertEquals("gpt-4-turbo-preview", stored.get("model"));
        assertEquals(JobStatus.COMPLETED, store.getJob(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void promptListsRequestedCategories() throws Exception {
        ProcessingJob job = saveJob(Map.of("categories", List.of("Invoice", "Receipt")));
        when(openAiApiClient.isConfigured()).thenReturn(true);
        when(openAiApiClient.complete(anyString(), anyString(), anyDouble(), anyInt())).thenReturn(CLASSIFICATION);

        processor.process(contextFor(job));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(openAiApiClient).complete(anyString(), prompt.capture(), anyDouble(), anyInt());
        assertThat(prompt.getValue()).contains("Invoice, Receipt").contains("acme-invoice.pdf")
                .doesNotContain("Contract");
    }

    @Test
    void entitiesAreExtractedWhenRequested() throws Exception {
        ProcessingJob job = saveJob(Map.of("extractEntities", true));
        when(openAiApiClient.isConfigured()).thenReturn(true);
        when(openAiApiClient.complete(anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(CLASSIFICATION)
                .thenReturn("{\"organizations\": [\"ACME Corp\"], \"amounts\": [\"1,200 EUR\"], \"colors\": [\"red\"]}");

        Map<String, Object> output = processor.process(contextFor(job));

        verify(openAiApiClient, times(2)).complete(anyString(), anyString(), anyDouble(), anyInt());
        assertEquals(Map.of("organizations", List.of("ACME Corp"), "amounts", List.of("1,200 EUR")),
                     output.get("entities"));
    }

    @Test
    void missingApiKeySkipsClassification() throws Exception {
        ProcessingJob job = saveJob(Map.of());
        when(openAiApiClient.isConfigured()).thenReturn(false);

        Map<String, Object> output = processor.process(contextFor(job));

        assertEquals("Unknown", output.get("category"));
        assertEquals(true, output.get("skipped"));
        verify(openAiApiClient, never()).complete(anyString(), anyString(), anyDouble(), anyInt());
    }

    private ProcessingJob saveJob(Map<String, Object> options) {
        ProcessingJob job = new ProcessingJob();
        job.setDocumentId("doc-1");
        job.setJobType(JobType.AI_CLASSIFY);
        job.setStatus(JobStatus.PENDING);
        job.setInputParams(new HashMap<>(options));
        return store.createJob(job);
    }

    private static JobExecutionContext contextFor(ProcessingJob job) {
        QueueJob queueJob = QueueJob.builder()
                .id(job.getId())
                .payload(JobPayload.builder()
                                 .documentId("doc-1")
                                 .organizationId("org-1")
                                 .jobType(JobType.AI_CLASSIFY)
                                 .options(new HashMap<>(job.getInputParams()))
                                 .build())
                .attempts(3)
                .state(QueueJobState.ACTIVE)
                .build();
        return new JobExecutionContext(queueJob, progress -> { });
    }
}
