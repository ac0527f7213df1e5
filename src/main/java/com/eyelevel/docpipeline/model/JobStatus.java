package com.eyelevel.docpipeline.model;

import java.util.List;

/**
 * Lifecycle states of a {@link ProcessingJob}.
 * <p>
 * Transitions are monotonic apart from an explicit retry (FAILED to PENDING) and a cancel (PENDING to CANCELLED).
 */
public enum JobStatus {
    /**
     * Created and enqueued, waiting for a worker.
     */
    PENDING,
    /**
     * A worker has claimed the job and is executing it.
     */
    RUNNING,
    /**
     * Finished successfully; {@code outputData} holds the result summary.
     */
    COMPLETED,
    /**
     * The last attempt failed; {@code errorMessage} holds the reason.
     */
    FAILED,
    /**
     * Cancelled by a caller before a worker picked it up.
     */
    CANCELLED,
    /**
     * The worker stopped reporting liveness. Recovered by the queue without consuming an attempt.
     */
    STALLED;

    public static final List<JobStatus> ACTIVE_STATUSES = List.of(PENDING, RUNNING);
    public static final List<JobStatus> CLEANABLE_STATUSES = List.of(COMPLETED, FAILED, CANCELLED);

    public boolean isActive() {
        return ACTIVE_STATUSES.contains(this);
    }
}
