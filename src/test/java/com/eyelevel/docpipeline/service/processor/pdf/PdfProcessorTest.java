package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.common.json.jackson.JacksonJsonParser;
import com.eyelevel.docpipeline.common.time.MutableClock;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.exception.UnrecoverableJobException;
import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.DocumentStatus;
import com.eyelevel.docpipeline.model.JobStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.model.ProcessingJob;
import com.eyelevel.docpipeline.service.error.ErrorClassifier;
import com.eyelevel.docpipeline.service.processor.JobExecutionContext;
import com.eyelevel.docpipeline.service.queue.JobPayload;
import com.eyelevel.docpipeline.service.queue.QueueJob;
import com.eyelevel.docpipeline.service.queue.QueueJobState;
import com.eyelevel.docpipeline.service.storage.ObjectStore;
import com.eyelevel.docpipeline.service.store.InMemoryProcessingStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PdfProcessorTest {

    @Mock
    private ObjectStore objectStore;
    @Mock
    private GhostscriptCompressor ghostscriptCompressor;

    private final InMemoryProcessingStore store = new InMemoryProcessingStore();
    private final PdfOperations pdfOperations = new PdfOperations();
    private PdfProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new PdfProcessor(store, new ErrorClassifier(), MutableClock.startingAt("2026-07-20T11:00:00Z"),
                                     objectStore, pdfOperations, ghostscriptCompressor, new PipelineProperties(),
                                     new JacksonJsonParser(new ObjectMapper()));
    }

    @Test
    void splitRegistersOneDocumentPerRange() throws Exception {
        saveDocument("doc-1", "org-1", "contract.pdf");
        when(objectStore.getObjectBytes("org-1/contract.pdf")).thenReturn(pdfWithPages(5));
        ProcessingJob job = saveJob(JobType.PDF_SPLIT, Map.of("ranges", List.of("1-2", "3-5"), "outputPrefix", "part"));

        Map<String, Object> output = processor.process(contextFor(job));

        assertEquals(2, output.get("totalSplits"));
        assertEquals(5, output.get("sourceTotalPages"));
        List<?> outputs = (List<?>) output.get("outputDocuments");
        Map<?, ?> first = (Map<?, ?>) outputs.get(0);
        Map<?, ?> last = (Map<?, ?>) outputs.get(1);
        assertEquals("part_split_1_pages_1-2.pdf", first.get("filename"));
        assertEquals(3, last.get("pageCount"));

        Document second = store.getDocument((String) last.get("documentId")).orElseThrow();
        assertEquals("org-1", second.getOrganizationId());
        assertEquals(DocumentStatus.READY, second.getStatus());
        assertEquals("doc-1", second.getMetadata().get("splitFrom"));
        assertEquals("3-5", second.getMetadata().get("pageRange"));
        assertThat(second.getS3Key()).startsWith("org-1/").endsWith("/part_split_2_pages_3-5.pdf");
        verify(objectStore, times(2)).uploadBuffer(anyString(), any(byte[].class), eq("application/pdf"));
    }

    @Test
    void mergeRejectsDocumentsOfAnotherOrganization() {
        saveDocument("doc-1", "org-1", "a.pdf");
        saveDocument("doc-2", "org-2", "b.pdf");
        ProcessingJob job = saveJob(JobType.PDF_MERGE, Map.of("documentIds", List.of("doc-1", "doc-2")));

        UnrecoverableJobException error = assertThrows(UnrecoverableJobException.class,
                                                       () -> processor.process(contextFor(job)));

        assertEquals("Resource not found", error.getMessage());
        assertThat(error.getCause()).hasMessage("Some documents were not found or are not PDFs");
        verify(objectStore, never()).getObjectBytes(anyString());
        assertEquals(JobStatus.FAILED, store.getJob(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void mergeConcatenatesInRequestedOrder() throws Exception {
        saveDocument("doc-1", "org-1", "a.pdf");
        saveDocument("doc-2", "org-1", "b.pdf");
        when(objectStore.getObjectBytes("org-1/a.pdf")).thenReturn(pdfWithPages(1));
        when(objectStore.getObjectBytes("org-1/b.pdf")).thenReturn(pdfWithPages(3));
        ProcessingJob job = saveJob(JobType.PDF_MERGE,
                                    Map.of("documentIds", List.of("doc-2", "doc-1"), "outputName", "bundle.pdf"));

        Map<String, Object> output = processor.process(contextFor(job));

        assertEquals(4, output.get("pageCount"));
        assertEquals("bundle.pdf", output.get("filename"));
        assertEquals(List.of("doc-2", "doc-1"), output.get("sourceDocumentIds"));
        Document merged = store.getDocument((String) output.get("documentId")).orElseThrow();
        assertEquals(List.of("doc-2", "doc-1"), merged.getMetadata().get("mergedFrom"));
    }

    @Test
    void extractingAPageOutOfBoundsFails() throws Exception {
        saveDocument("doc-1", "org-1", "contract.pdf");
        when(objectStore.getObjectBytes("org-1/contract.pdf")).thenReturn(pdfWithPages(2));
        ProcessingJob job = saveJob(JobType.PDF_EXTRACT_PAGES, Map.of("pages", List.of(1, 5)));

        ProcessingException error = assertThrows(ProcessingException.class, () -> processor.process(contextFor(job)));

        assertEquals("Page 5 is out of bounds (document has 2 pages)", error.getMessage());
        verify(objectStore, never()).uploadBuffer(anyString(), any(), anyString());
    }

    @Test
    void compressFallsBackToPdfBoxWhenGhostscriptIsDisabled() throws Exception {
        saveDocument("doc-1", "org-1", "scan.pdf");
        byte[] original = pdfWithPages(3);
        when(objectStore.getObjectBytes("org-1/scan.pdf")).thenReturn(original);
        ProcessingJob job = saveJob(JobType.PDF_COMPRESS, Map.of("quality", "high"));

        Map<String, Object> output = processor.process(contextFor(job));

        assertEquals("pdfbox", output.get("method"));
        assertEquals(original.length, output.get("originalSizeBytes"));
        assertThat((Integer) output.get("compressedSizeBytes")).isLessThanOrEqualTo(original.length);
        verify(ghostscriptCompressor, never()).compress(any(), anyString(), anyString());
    }

    @Test
    void metadataIsStoredOnTheSourceDocument() throws Exception {
        saveDocument("doc-1", "org-1", "contract.pdf");
        when(objectStore.getObjectBytes("org-1/contract.pdf")).thenReturn(pdfWithPages(2));
        ProcessingJob job = saveJob(JobType.PDF_METADATA, Map.of());

        processor.process(contextFor(job));

        Map<?, ?> pdf = (Map<?, ?>) store.getDocument("doc-1").orElseThrow().getMetadata().get("pdf");
        assertEquals(2, pdf.get("pageCount"));
    }

    @Test
    void nonPdfSourceIsRejected() {
        Document document = saveDocument("doc-1", "org-1", "notes.txt");
        document.setMimeType("text/plain");
        ProcessingJob job = saveJob(JobType.PDF_SPLIT, Map.of());

        UnrecoverableJobException error = assertThrows(UnrecoverableJobException.class,
                                                       () -> processor.process(contextFor(job)));

        assertEquals("Unsupported file type for PDF processing: text/plain", error.getMessage());
        verify(objectStore, never()).getObjectBytes(anyString());
    }

    private Document saveDocument(String id, String organizationId, String name) {
        Document document = new Document();
        document.setId(id);
        document.setOrganizationId(organizationId);
        document.setName(name);
        document.setMimeType("application/pdf");
        document.setSizeBytes(2048);
        document.setS3Key(organizationId + "/" + name);
        return store.saveDocument(document);
    }

    private ProcessingJob saveJob(JobType jobType, Map<String, Object> options) {
        ProcessingJob job = new ProcessingJob();
        job.setDocumentId("doc-1");
        job.setJobType(jobType);
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
                                 .jobType(job.getJobType())
                                 .options(new HashMap<>(job.getInputParams()))
                                 .build())
                .attempts(3)
                .state(QueueJobState.ACTIVE)
                .build();
        return new JobExecutionContext(queueJob, progress -> { });
    }

    private static byte[] pdfWithPages(int count) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < count; i++) {
                document.addPage(new PDPage());
            }
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            document.save(output);
            return output.toByteArray();
        }
    }
}
