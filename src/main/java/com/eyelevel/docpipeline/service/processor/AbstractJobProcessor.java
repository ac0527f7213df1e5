package com.eyelevel.docpipeline.service.processor;

import com.eyelevel.docpipeline.exception.DelayedRetryException;
import com.eyelevel.docpipeline.exception.ResourceNotFoundException;
import com.eyelevel.docpipeline.exception.UnrecoverableJobException;
import com.eyelevel.docpipeline.model.*;
import com.eyelevel.docpipeline.service.error.ErrorClassifier;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared lifecycle of every processor.
 * <ol>
 *     <li>The job record is marked RUNNING and the document moved to its in-progress status before any
 *     external work.</li>
 *     <li>{@link #execute(JobExecutionContext)} runs the domain logic.</li>
 *     <li>On success the summary is persisted with status COMPLETED, then progress 100 is reported.</li>
 *     <li>On failure the error is classified and persisted with status FAILED. A permanent failure also fails
 *     the document and is rethrown as {@link UnrecoverableJobException}; a rate-limited failure is rethrown as
 *     {@link DelayedRetryException}; anything else is rethrown as is for the queue's own backoff.</li>
 * </ol>
 */
@Slf4j
public abstract class AbstractJobProcessor implements JobProcessor {

    private static final int MAX_STACK_LENGTH = 8_000;

    protected final ProcessingStore store;
    protected final ErrorClassifier errorClassifier;
    protected final Clock clock;

    protected AbstractJobProcessor(ProcessingStore store, ErrorClassifier errorClassifier, Clock clock) {
        this.store = store;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
    }

    /**
     * Runs the domain logic of one job.
     *
     * @return the output summary; never the binary payload itself.
     */
    protected abstract Map<String, Object> execute(JobExecutionContext context) throws Exception;

    /**
     * The processing status the document shows while a job of this processor runs.
     */
    protected DocumentProcessingStatus inProgressStatus(JobType jobType) {
        return DocumentProcessingStatus.PROCESSING;
    }

    @Override
    public final Map<String, Object> process(JobExecutionContext context) throws Exception {
        final String contextInfo = context.getContextInfo();
        Optional<ProcessingJob> record = store.getJob(context.getJobId());
        if (record.isEmpty()) {
            throw new UnrecoverableJobException("Processing job not found: " + context.getJobId(), null);
        }
        if (record.get().getStatus() == JobStatus.CANCELLED) {
            log.info("[{}] Job was cancelled before it started. Skipping.", contextInfo);
            return Map.of("skipped", true, "reason", "cancelled");
        }

        long startTime = clock.millis();
        log.info("[{}] Starting {} job (attempt {}).", contextInfo, context.getJobType(), context.getAttemptsMade() + 1);
        store.updateJob(context.getJobId(), job -> {
            job.setStatus(JobStatus.RUNNING);
            job.setDeliveryAttempts(context.getAttemptsMade());
            job.setStartedAt(now());
            job.setCompletedAt(null);
            job.setErrorMessage(null);
            job.setErrorStack(null);
            job.setErrorCategory(null);
        });
        store.updateDocument(context.getDocumentId(),
                document -> document.setProcessingStatus(inProgressStatus(context.getJobType())));

        try {
            Map<String, Object> result = new LinkedHashMap<>(execute(context));
            long durationMs = clock.millis() - startTime;
            result.putIfAbsent("durationMs", durationMs);

            store.updateJob(context.getJobId(), job -> {
                job.setStatus(JobStatus.COMPLETED);
                job.setCompletedAt(now());
                job.setOutputData(result);
            });
            context.reportProgress(100);
            log.info("[{}] {} job completed in {}ms.", contextInfo, context.getJobType(), durationMs);
            return result;
        } catch (Exception e) {
            throw handleFailure(context, e, clock.millis() - startTime);
        }
    }

    private Exception handleFailure(JobExecutionContext context, Exception error, long durationMs) {
        final String contextInfo = context.getContextInfo();
        CategorizedError categorized = errorClassifier.classify(error);
        log.error("[{}] {} job failed after {}ms ({}): {}", contextInfo, context.getJobType(), durationMs,
                  categorized.category(), categorized.message(), error);

        try {
            store.updateJob(context.getJobId(), job -> {
                job.setStatus(JobStatus.FAILED);
                job.setCompletedAt(now());
                job.setErrorMessage(categorized.message());
                job.setErrorStack(stackTraceOf(error));
                job.setErrorCategory(categorized.category());
                job.setDeliveryAttempts(categorized.category() == ErrorCategory.RATE_LIMITED
                        ? context.getAttemptsMade()
                        : context.getAttemptsMade() + 1);
            });
        } catch (RuntimeException storeError) {
            log.warn("[{}] Failed to record job failure: {}", contextInfo, storeError.getMessage());
        }

        return switch (categorized.category()) {
            case PERMANENT -> {
                try {
                    store.updateDocument(context.getDocumentId(),
                            document -> document.setProcessingStatus(DocumentProcessingStatus.FAILED));
                } catch (RuntimeException storeError) {
                    log.warn("[{}] Failed to mark document as failed: {}", contextInfo, storeError.getMessage());
                }
                yield new UnrecoverableJobException(categorized.message(), error);
            }
            case RATE_LIMITED -> new DelayedRetryException(categorized.message(),
                    categorized.retryAfterMs() != null ? categorized.retryAfterMs()
                            : ErrorClassifier.DEFAULT_RETRY_AFTER_MS, error);
            case TRANSIENT, UNKNOWN -> error;
        };
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Loads the job's document or fails with a "not found" message, which classifies as permanent.
     */
    protected Document requireDocument(String documentId) {
        return store.getDocument(documentId)
                .orElseThrow(() -> new ResourceNotFoundException("Document not found: " + documentId));
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        String stack = writer.toString();
        return stack.length() > MAX_STACK_LENGTH ? stack.substring(0, MAX_STACK_LENGTH) : stack;
    }
}
