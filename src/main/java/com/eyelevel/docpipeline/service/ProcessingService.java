package com.eyelevel.docpipeline.service;

import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.dto.job.request.AddJobRequest;
import com.eyelevel.docpipeline.dto.job.response.AddJobResponse;
import com.eyelevel.docpipeline.dto.job.response.FailedJobsResponse;
import com.eyelevel.docpipeline.dto.job.response.ProcessingJobResponse;
import com.eyelevel.docpipeline.dto.queue.response.CleanupResponse;
import com.eyelevel.docpipeline.dto.queue.response.DrainResponse;
import com.eyelevel.docpipeline.dto.queue.response.QueueInfo;
import com.eyelevel.docpipeline.dto.queue.response.QueueStats;
import com.eyelevel.docpipeline.dto.queue.response.QueueStatsOverview;
import com.eyelevel.docpipeline.exception.JobConfigurationException;
import com.eyelevel.docpipeline.exception.JobStateException;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.exception.ResourceNotFoundException;
import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.DocumentProcessingStatus;
import com.eyelevel.docpipeline.model.JobStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.model.ProcessingJob;
import com.eyelevel.docpipeline.service.queue.JobCounts;
import com.eyelevel.docpipeline.service.queue.JobOptions;
import com.eyelevel.docpipeline.service.queue.JobPayload;
import com.eyelevel.docpipeline.service.queue.JobQueue;
import com.eyelevel.docpipeline.service.queue.ProcessingQueues;
import com.eyelevel.docpipeline.service.queue.QueueJob;
import com.eyelevel.docpipeline.service.queue.QueueJobState;
import com.eyelevel.docpipeline.service.routing.JobRoute;
import com.eyelevel.docpipeline.service.routing.JobRouter;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the pipeline: creates job records, routes them to their queue and exposes status, retry,
 * cancellation, queue statistics and cleanup.
 * <p>
 * The job record is always written before the matching queue operation, so the store stays the source of truth.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessingService {

    static final int QUEUE_CLEAN_LIMIT = 1000;
    private static final int MAX_FAILED_PAGE_SIZE = 100;

    private final ProcessingStore store;
    private final ProcessingQueues queues;
    private final JobRouter jobRouter;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Creates the job record, marks the document PENDING and enqueues the job under the record's id.
     *
     * @throws JobConfigurationException if the job type is unknown.
     * @throws ResourceNotFoundException if the document does not exist.
     */
    public AddJobResponse addJob(AddJobRequest request) {
        JobType jobType = jobRouter.resolveJobType(request.getJobType());
        JobRoute route = jobRouter.route(jobType);
        Document document = store.getDocument(request.getDocumentId())
                .orElseThrow(() -> new ResourceNotFoundException("Document not found: " + request.getDocumentId()));

        int attempts = request.getAttempts() != null ? request.getAttempts() : properties.getRetry().getAttempts();
        int priority = request.getPriority() != null ? request.getPriority() : route.defaultPriority();
        Map<String, Object> options = request.getOptions() != null ? new HashMap<>(request.getOptions()) : new HashMap<>();

        ProcessingJob job = new ProcessingJob();
        job.setDocumentId(document.getId());
        job.setJobType(jobType);
        job.setStatus(JobStatus.PENDING);
        job.setPriority(priority);
        job.setAttempts(0);
        job.setMaxAttempts(attempts);
        job.setInputParams(options);
        ProcessingJob created = store.createJob(job);

        store.updateDocument(document.getId(), doc -> doc.setProcessingStatus(DocumentProcessingStatus.PENDING));

        String queueJobId = enqueue(created, document, route, JobOptions.builder()
                .jobId(created.getId())
                .priority(priority)
                .delayMs(request.getDelayMs())
                .attempts(attempts)
                .build());
        log.info("[JobId: {}, DocumentId: {}] Queued {} job on {} with priority {}.", created.getId(),
                 document.getId(), jobType, route.queue().getValue(), priority);

        return AddJobResponse.builder()
                .jobId(created.getId())
                .queueJobId(queueJobId)
                .queueName(route.queue().getValue())
                .build();
    }

    /**
     * Adds a job with default delivery options.
     */
    public AddJobResponse addJob(String documentId, JobType jobType, Map<String, Object> options) {
        return addJob(AddJobRequest.builder()
                .documentId(documentId)
                .jobType(jobType.name())
                .options(options)
                .build());
    }

    /**
     * The job record, enriched with its queue state and progress when the queue still holds it.
     */
    public ProcessingJobResponse getJobStatus(String jobId) {
        ProcessingJob job = requireJob(jobId);
        ProcessingJobResponse response = ProcessingJobResponse.from(job);
        Optional<QueueJob> queueJob = findQueueJob(job);
        if (queueJob.isEmpty()) {
            return response.toBuilder()
                    .progress(job.getStatus() == JobStatus.COMPLETED ? 100 : 0)
                    .build();
        }
        return response.toBuilder()
                .queueName(jobRouter.route(job.getJobType()).queue().getValue())
                .queueState(queueJob.get().getState().name())
                .progress(queueJob.get().getProgress())
                .build();
    }

    /**
     * Re-enqueues a FAILED job under its original id.
     *
     * @throws JobStateException if the job is not FAILED or has used all its attempts; nothing is changed then.
     */
    public AddJobResponse retryJob(String jobId) {
        ProcessingJob job = requireJob(jobId);
        if (job.getStatus() != JobStatus.FAILED) {
            throw new JobStateException("Only failed jobs can be retried. Current status: " + job.getStatus());
        }
        if (job.getAttempts() >= job.getMaxAttempts()) {
            throw new JobStateException("Maximum retry attempts (" + job.getMaxAttempts() + ") reached for job "
                    + jobId);
        }
        Document document = store.getDocument(job.getDocumentId())
                .orElseThrow(() -> new ResourceNotFoundException("Document not found: " + job.getDocumentId()));

        ProcessingJob updated = store.updateJob(jobId, record -> {
            record.setStatus(JobStatus.PENDING);
            record.setAttempts(record.getAttempts() + 1);
            record.setDeliveryAttempts(0);
            record.setErrorMessage(null);
            record.setErrorStack(null);
            record.setErrorCategory(null);
            record.setStartedAt(null);
            record.setCompletedAt(null);
        });
        store.updateDocument(document.getId(), doc -> doc.setProcessingStatus(DocumentProcessingStatus.PENDING));

        JobRoute route = jobRouter.route(updated.getJobType());
        String queueJobId = enqueue(updated, document, route, JobOptions.builder()
                .jobId(updated.getId())
                .priority(updated.getPriority())
                .attempts(updated.getMaxAttempts())
                .build());
        log.info("[JobId: {}, DocumentId: {}] Retrying {} job (retry {} of {}).", jobId, document.getId(),
                 updated.getJobType(), updated.getAttempts(), updated.getMaxAttempts());

        return AddJobResponse.builder()
                .jobId(updated.getId())
                .queueJobId(queueJobId)
                .queueName(route.queue().getValue())
                .build();
    }

    /**
     * Cancels a PENDING job and removes it from its queue and the legacy queue. Queue removal is best-effort: a
     * job a worker already claimed finds its record CANCELLED and skips.
     *
     * @throws JobStateException if the job is not PENDING.
     */
    public ProcessingJobResponse cancelJob(String jobId) {
        ProcessingJob job = requireJob(jobId);
        if (job.getStatus() != JobStatus.PENDING) {
            throw new JobStateException("Only pending jobs can be cancelled. Current status: " + job.getStatus());
        }
        ProcessingJob cancelled = store.updateJob(jobId, record -> {
            record.setStatus(JobStatus.CANCELLED);
            record.setCompletedAt(LocalDateTime.now(clock));
        });

        removeQuietly(queues.get(jobRouter.route(job.getJobType()).queue()), jobId);
        queues.legacy().ifPresent(legacy -> removeQuietly(legacy, jobId));
        log.info("[JobId: {}, DocumentId: {}] Job cancelled.", jobId, job.getDocumentId());
        return ProcessingJobResponse.from(cancelled);
    }

    public List<QueueInfo> getQueues() {
        return queues.all().stream()
                .map(queue -> new QueueInfo(queue.getName().getValue(), queue.getName().getDescription()))
                .toList();
    }

    /**
     * Counts of every registered queue plus their sum.
     */
    public QueueStatsOverview getQueueStats() {
        List<QueueStats> stats = queues.all().stream().map(ProcessingService::statsOf).toList();
        QueueStats totals = QueueStats.builder()
                .name("total")
                .waiting(stats.stream().mapToLong(QueueStats::getWaiting).sum())
                .active(stats.stream().mapToLong(QueueStats::getActive).sum())
                .completed(stats.stream().mapToLong(QueueStats::getCompleted).sum())
                .failed(stats.stream().mapToLong(QueueStats::getFailed).sum())
                .delayed(stats.stream().mapToLong(QueueStats::getDelayed).sum())
                .paused(stats.stream().mapToLong(QueueStats::getPaused).sum())
                .build();
        return QueueStatsOverview.builder().queues(stats).totals(totals).build();
    }

    /**
     * @throws ResourceNotFoundException if no queue has that name.
     */
    public QueueStats getQueueStatsByName(String queueName) {
        return statsOf(queues.getByValue(queueName));
    }

    public void pauseQueue(String queueName) {
        queues.getByValue(queueName).pause();
        log.info("Queue {} paused.", queueName);
    }

    public void resumeQueue(String queueName) {
        queues.getByValue(queueName).resume();
        log.info("Queue {} resumed.", queueName);
    }

    /**
     * Pauses the queue, removes every waiting and delayed job one by one and resumes it. A job that cannot be
     * removed, typically one a worker claimed in the meantime, is skipped and not counted.
     */
    public DrainResponse drainQueue(String queueName) {
        JobQueue queue = queues.getByValue(queueName);
        queue.pause();
        int removed = 0;
        try {
            List<QueueJob> jobs = new ArrayList<>(queue.getWaiting());
            jobs.addAll(queue.getDelayed());
            for (QueueJob job : jobs) {
                try {
                    if (queue.remove(job.getId())) {
                        removed++;
                        markDrained(job.getId());
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to remove job {} while draining {}: {}", job.getId(), queueName, e.getMessage());
                }
            }
        } finally {
            queue.resume();
        }
        log.info("Drained {} job(s) from queue {}.", removed, queueName);
        return new DrainResponse(queueName, removed);
    }

    /**
     * Deletes finished job records older than the cut-off, then prunes finished entries from every queue.
     * Queue pruning errors are collected in the response instead of aborting the sweep.
     */
    public CleanupResponse cleanOldJobs(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new JobConfigurationException("olderThanDays must not be negative: " + olderThanDays);
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(olderThanDays);
        int deletedRecords = store.deleteJobsOlderThan(JobStatus.CLEANABLE_STATUSES, cutoff);

        long graceMs = Duration.ofDays(olderThanDays).toMillis();
        int removedQueueJobs = 0;
        List<String> errors = new ArrayList<>();
        for (JobQueue queue : queues.all()) {
            for (QueueJobState state : List.of(QueueJobState.COMPLETED, QueueJobState.FAILED)) {
                try {
                    removedQueueJobs += queue.clean(graceMs, QUEUE_CLEAN_LIMIT, state).size();
                } catch (RuntimeException e) {
                    String error = String.format("%s (%s): %s", queue.getName().getValue(), state, e.getMessage());
                    log.warn("Queue cleanup failed for {}", error);
                    errors.add(error);
                }
            }
        }
        log.info("Cleanup removed {} job record(s) and {} queue entr(ies) older than {} day(s).", deletedRecords,
                 removedQueueJobs, olderThanDays);
        return CleanupResponse.builder()
                .deletedRecords(deletedRecords)
                .removedQueueJobs(removedQueueJobs)
                .errors(errors)
                .build();
    }

    public List<ProcessingJobResponse> getJobsByDocument(String documentId) {
        return store.findJobsByDocument(documentId).stream().map(ProcessingJobResponse::from).toList();
    }

    public FailedJobsResponse getFailedJobs(int limit, int offset) {
        if (limit < 1 || limit > MAX_FAILED_PAGE_SIZE || offset < 0) {
            throw new JobConfigurationException("limit must be between 1 and " + MAX_FAILED_PAGE_SIZE
                    + " and offset must not be negative");
        }
        List<ProcessingJobResponse> jobs = store.findFailedJobs(limit, offset).stream()
                .map(ProcessingJobResponse::from)
                .toList();
        return FailedJobsResponse.builder()
                .jobs(jobs)
                .total(store.countJobsByStatus(JobStatus.FAILED))
                .limit(limit)
                .offset(offset)
                .build();
    }

    /**
     * Enqueues an existing record again under its own id, e.g. after a restart. The run keeps the delivery
     * attempts it already used.
     */
    public String requeue(ProcessingJob job) {
        Document document = store.getDocument(job.getDocumentId())
                .orElseThrow(() -> new ResourceNotFoundException("Document not found: " + job.getDocumentId()));
        return enqueue(job, document, jobRouter.route(job.getJobType()), JobOptions.builder()
                .jobId(job.getId())
                .priority(job.getPriority())
                .attempts(job.getMaxAttempts())
                .attemptsMade(job.getDeliveryAttempts())
                .build());
    }

    private String enqueue(ProcessingJob job, Document document, JobRoute route, JobOptions options) {
        JobPayload payload = JobPayload.builder()
                .documentId(document.getId())
                .s3Key(document.getS3Key())
                .organizationId(document.getOrganizationId())
                .jobType(job.getJobType())
                .options(job.getInputParams() != null ? new HashMap<>(job.getInputParams()) : new HashMap<>())
                .build();
        try {
            return queues.get(route.queue()).add(route.jobKind(), payload, options);
        } catch (RuntimeException e) {
            log.error("[JobId: {}] Failed to enqueue job on {}.", job.getId(), route.queue().getValue(), e);
            store.updateJob(job.getId(), record -> {
                record.setStatus(JobStatus.FAILED);
                record.setErrorMessage("Failed to enqueue job: " + e.getMessage());
                record.setCompletedAt(LocalDateTime.now(clock));
            });
            throw new ProcessingException("Failed to enqueue job " + job.getId(), e);
        }
    }

    private Optional<QueueJob> findQueueJob(ProcessingJob job) {
        Optional<QueueJob> primary = queues.get(jobRouter.route(job.getJobType()).queue()).getJob(job.getId());
        if (primary.isPresent()) {
            return primary;
        }
        return queues.legacy().flatMap(legacy -> legacy.getJob(job.getId()));
    }

    private ProcessingJob requireJob(String jobId) {
        return store.getJob(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Processing job not found: " + jobId));
    }

    private void removeQuietly(JobQueue queue, String jobId) {
        try {
            queue.remove(jobId);
        } catch (RuntimeException e) {
            log.warn("[JobId: {}] Could not remove job from {}: {}", jobId, queue.getName().getValue(),
                     e.getMessage());
        }
    }

    private void markDrained(String jobId) {
        try {
            store.getJob(jobId)
                    .filter(job -> job.getStatus() == JobStatus.PENDING)
                    .ifPresent(job -> store.updateJob(jobId, record -> {
                        record.setStatus(JobStatus.CANCELLED);
                        record.setErrorMessage("Removed by queue drain");
                        record.setCompletedAt(LocalDateTime.now(clock));
                    }));
        } catch (RuntimeException e) {
            log.warn("[JobId: {}] Drained from queue but the record could not be updated: {}", jobId, e.getMessage());
        }
    }

    private static QueueStats statsOf(JobQueue queue) {
        JobCounts counts = queue.getCounts();
        return QueueStats.builder()
                .name(queue.getName().getValue())
                .waiting(counts.waiting())
                .active(counts.active())
                .completed(counts.completed())
                .failed(counts.failed())
                .delayed(counts.delayed())
                .paused(queue.isPaused() ? 1 : 0)
                .build();
    }
}
