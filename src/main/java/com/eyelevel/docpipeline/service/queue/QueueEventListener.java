package com.eyelevel.docpipeline.service.queue;

import java.util.Map;

/**
 * Receives lifecycle notifications from a {@link JobQueue}. Callbacks run on worker or timer threads.
 */
public interface QueueEventListener {

    default void onActive(QueueName queue, QueueJob job) {
    }

    default void onProgress(QueueName queue, QueueJob job, int progress) {
    }

    default void onCompleted(QueueName queue, QueueJob job, Map<String, Object> result) {
    }

    /**
     * Called once the job has failed for good: attempts exhausted or failure marked unrecoverable.
     */
    default void onFailed(QueueName queue, QueueJob job, Throwable error) {
    }

    default void onStalled(QueueName queue, QueueJob job) {
    }
}
