package com.eyelevel.docpipeline.service.queue;

import java.util.List;
import java.util.Optional;

/**
 * A named job queue with priority ordering, delayed delivery, retries and per-queue
 * concurrency and rate limits.
 */
public interface JobQueue {

    QueueName getName();

    /**
     * Enqueues a job.
     *
     * @return the queue job id, equal to {@link JobOptions#getJobId()} when one was given.
     */
    String add(String jobKind, JobPayload payload, JobOptions options);

    Optional<QueueJob> getJob(String jobId);

    List<QueueJob> getWaiting();

    List<QueueJob> getDelayed();

    /**
     * Removes a job that is not currently being processed.
     *
     * @return false if no such job exists.
     * @throws com.eyelevel.docpipeline.exception.JobStateException if the job is active.
     */
    boolean remove(String jobId);

    void pause();

    void resume();

    boolean isPaused();

    /**
     * Removes finished jobs of the given state that finished more than {@code graceMs} ago.
     *
     * @param limit maximum number of jobs to remove; zero or less means no limit.
     * @return ids of the removed jobs.
     */
    List<String> clean(long graceMs, int limit, QueueJobState state);

    JobCounts getCounts();

    void setHandler(JobHandler handler);

    void addListener(QueueEventListener listener);

    /**
     * Whether queued jobs survive a restart of this process.
     */
    default boolean isDurable() {
        return false;
    }

    void close();
}
