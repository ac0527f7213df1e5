package com.eyelevel.docpipeline.service.lifecycle;

import com.eyelevel.docpipeline.model.ErrorCategory;
import com.eyelevel.docpipeline.model.JobStatus;
import com.eyelevel.docpipeline.model.ProcessingJob;
import com.eyelevel.docpipeline.service.ProcessingService;
import com.eyelevel.docpipeline.service.queue.JobQueue;
import com.eyelevel.docpipeline.service.queue.ProcessingQueues;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Puts unfinished work back on in-memory queues after a restart. Such queues lose their content with the process,
 * so the store is the only record of what was waiting, running or scheduled for a retry when the previous instance
 * stopped. Durable queues keep their messages and are left alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueRecoveryService {

    static final String INTERRUPTED_MESSAGE = "Worker stopped while the job was running";

    private final ProcessingStore store;
    private final ProcessingService processingService;
    private final ProcessingQueues queues;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (queues.primaryQueues().stream().allMatch(JobQueue::isDurable)) {
            log.info("Job queues are durable. Skipping startup recovery.");
            return;
        }

        int pending = requeueAll(store.findJobsByStatus(JobStatus.PENDING));

        List<ProcessingJob> interrupted = store.findJobsByStatus(JobStatus.RUNNING).stream()
                .map(job -> store.updateJob(job.getId(), record -> {
                    record.setStatus(JobStatus.STALLED);
                    record.setErrorMessage(INTERRUPTED_MESSAGE);
                }))
                .toList();
        int stalled = requeueAll(interrupted);

        List<ProcessingJob> awaitingRetry = store.findJobsByStatus(JobStatus.FAILED).stream()
                .filter(QueueRecoveryService::hasRetryLeft)
                .map(job -> store.updateJob(job.getId(), record -> record.setStatus(JobStatus.PENDING)))
                .toList();
        int retries = requeueAll(awaitingRetry);

        if (pending + stalled + retries > 0) {
            log.info("Startup recovery re-enqueued {} pending, {} interrupted and {} retrying job(s).", pending,
                     stalled, retries);
        } else {
            log.info("Startup recovery found no unfinished jobs.");
        }
    }

    /**
     * Whether the failure left a queue retry behind: a rate-limited attempt is always retried, a transient or
     * unknown one while delivery attempts remain.
     */
    static boolean hasRetryLeft(ProcessingJob job) {
        ErrorCategory category = job.getErrorCategory();
        if (category == null || category == ErrorCategory.PERMANENT) {
            return false;
        }
        return category == ErrorCategory.RATE_LIMITED || job.getDeliveryAttempts() < job.getMaxAttempts();
    }

    private int requeueAll(List<ProcessingJob> jobs) {
        int requeued = 0;
        for (ProcessingJob job : jobs) {
            try {
                processingService.requeue(job);
                requeued++;
            } catch (RuntimeException e) {
                log.error("[JobId: {}, DocumentId: {}] Could not re-enqueue job on startup.", job.getId(),
                          job.getDocumentId(), e);
            }
        }
        return requeued;
    }
}
