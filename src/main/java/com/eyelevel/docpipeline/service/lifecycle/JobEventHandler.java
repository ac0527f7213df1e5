package com.eyelevel.docpipeline.service.lifecycle;

import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.DocumentProcessingStatus;
import com.eyelevel.docpipeline.model.ErrorCategory;
import com.eyelevel.docpipeline.model.JobStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.model.ProcessingJob;
import com.eyelevel.docpipeline.service.ProcessingService;
import com.eyelevel.docpipeline.service.events.JobEventSubject;
import com.eyelevel.docpipeline.service.events.ProcessingEventEmitter;
import com.eyelevel.docpipeline.service.queue.QueueEventListener;
import com.eyelevel.docpipeline.service.queue.QueueJob;
import com.eyelevel.docpipeline.service.queue.QueueName;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reacts to queue lifecycle notifications: keeps the document status in step with its jobs, emits events and
 * chains EMBEDDING and AI_CLASSIFY after a successful OCR.
 * <p>
 * Nothing thrown here reaches the queue; every failure is logged and the notification is dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobEventHandler implements QueueEventListener {

    static final List<JobType> OCR_DOWNSTREAM_TYPES = List.of(JobType.EMBEDDING, JobType.AI_CLASSIFY);
    static final String STALLED_MESSAGE = "Job stalled - worker may have crashed";

    private final ProcessingStore store;
    private final ProcessingEventEmitter eventEmitter;
    private final ProcessingService processingService;
    private final Clock clock;

    @Override
    public void onActive(QueueName queue, QueueJob job) {
        log.debug("[JobId: {}] Job active on {}.", job.getId(), queue.getValue());
        eventEmitter.emitStarted(JobEventSubject.of(job));
    }

    @Override
    public void onProgress(QueueName queue, QueueJob job, int progress) {
        if (progress % 25 == 0 || progress == 100) {
            log.debug("[JobId: {}] Progress {}%.", job.getId(), progress);
        }
        eventEmitter.emitProgress(JobEventSubject.of(job), progress);
    }

    @Override
    public void onCompleted(QueueName queue, QueueJob queueJob, Map<String, Object> result) {
        try {
            Optional<ProcessingJob> record = store.getJob(queueJob.getId());
            if (record.isEmpty()) {
                log.warn("[JobId: {}] Completed job has no processing record. Ignoring completion.", queueJob.getId());
                return;
            }
            ProcessingJob job = record.get();
            if (job.getStatus() != JobStatus.COMPLETED) {
                log.info("[JobId: {}] Completion ignored, record status is {}.", job.getId(), job.getStatus());
                return;
            }

            Document document = store.updateDocument(job.getDocumentId(),
                    doc -> applyCompletion(doc, job.getJobType(), result));

            if (job.getJobType() == JobType.OCR) {
                chainDownstreamJobs(job, document);
            }
            eventEmitter.emitCompleted(JobEventSubject.of(job, document), result);
        } catch (RuntimeException e) {
            log.error("[JobId: {}] Failed to handle job completion.", queueJob.getId(), e);
        }
    }

    @Override
    public void onFailed(QueueName queue, QueueJob queueJob, Throwable error) {
        String documentId = queueJob.getPayload().getDocumentId();
        log.warn("[JobId: {}, DocumentId: {}] Job failed for good on {}: {}", queueJob.getId(), documentId,
                 queue.getValue(), error.getMessage());
        try {
            store.getJob(queueJob.getId())
                    .filter(job -> job.getStatus() == JobStatus.RUNNING || job.getStatus() == JobStatus.STALLED)
                    .ifPresent(job -> markFailedByQueue(job, error));
            Document document = store.updateDocument(documentId,
                    doc -> doc.setProcessingStatus(DocumentProcessingStatus.FAILED));
            JobEventSubject subject = store.getJob(queueJob.getId())
                    .map(job -> JobEventSubject.of(job, document))
                    .orElseGet(() -> JobEventSubject.of(queueJob));
            eventEmitter.emitFailed(subject, error.getMessage());
        } catch (RuntimeException e) {
            log.error("[JobId: {}] Failed to handle job failure.", queueJob.getId(), e);
        }
    }

    @Override
    public void onStalled(QueueName queue, QueueJob queueJob) {
        log.warn("[JobId: {}] Job stalled on {}.", queueJob.getId(), queue.getValue());
        try {
            store.updateJob(queueJob.getId(), job -> {
                job.setStatus(JobStatus.STALLED);
                job.setErrorMessage(STALLED_MESSAGE);
            });
        } catch (RuntimeException e) {
            log.error("[JobId: {}] Failed to mark job as stalled.", queueJob.getId(), e);
        }
    }

    /**
     * Records a failure the processor never saw, e.g. a job that stalled too often. The queue has given up on it,
     * so its attempts count as used.
     */
    private void markFailedByQueue(ProcessingJob record, Throwable error) {
        store.updateJob(record.getId(), job -> {
            job.setStatus(JobStatus.FAILED);
            job.setCompletedAt(LocalDateTime.now(clock));
            job.setErrorMessage(error.getMessage());
            job.setErrorCategory(ErrorCategory.UNKNOWN);
            job.setDeliveryAttempts(Math.max(job.getDeliveryAttempts(), job.getMaxAttempts()));
        });
    }

    /**
     * Queues the OCR follow-up jobs. A type is skipped when a PENDING or RUNNING job of that type already exists
     * for the document, so a repeated completion never creates duplicates. EMBEDDING is also skipped when the
     * OCR job already stored the vector itself.
     */
    void chainDownstreamJobs(ProcessingJob ocrJob, Document document) {
        String text = document.getExtractedText();
        if (text == null || text.isBlank()) {
            log.info("[JobId: {}, DocumentId: {}] OCR produced no text. No downstream jobs.", ocrJob.getId(),
                     document.getId());
            return;
        }
        boolean embeddingGenerated = ocrJob.getOutputData() != null
                && Boolean.TRUE.equals(ocrJob.getOutputData().get("embeddingGenerated"));

        for (JobType type : OCR_DOWNSTREAM_TYPES) {
            if (type == JobType.EMBEDDING && embeddingGenerated) {
                log.debug("[DocumentId: {}] Embedding already generated with OCR.", document.getId());
                continue;
            }
            if (store.existsActiveJob(document.getId(), type)) {
                log.info("[DocumentId: {}] {} job already pending or running. Not chaining another.",
                         document.getId(), type);
                continue;
            }
            try {
                String jobId = processingService.addJob(document.getId(), type, Map.of()).getJobId();
                log.info("[JobId: {}, DocumentId: {}] Chained {} job after OCR.", jobId, document.getId(), type);
            } catch (RuntimeException e) {
                log.warn("[DocumentId: {}] Could not chain {} job: {}", document.getId(), type, e.getMessage());
            }
        }
    }

    private static void applyCompletion(Document document, JobType jobType, Map<String, Object> result) {
        if (jobType == JobType.OCR) {
            boolean embedded = result != null && Boolean.TRUE.equals(result.get("embeddingGenerated"));
            document.setProcessingStatus(embedded
                    ? DocumentProcessingStatus.COMPLETE
                    : DocumentProcessingStatus.OCR_COMPLETE);
        } else {
            document.setProcessingStatus(DocumentProcessingStatus.COMPLETE);
        }
        if (jobType == JobType.THUMBNAIL && result != null && result.get("thumbnailKey") instanceof String key) {
            document.setThumbnailKey(key);
        }
    }
}
