package com.eyelevel.docpipeline.service.queue;

import java.util.Map;

/**
 * Executes one delivered job. Throwing fails the attempt.
 */
@FunctionalInterface
public interface JobHandler {

    Map<String, Object> handle(QueueJob job, ProgressReporter progress) throws Exception;

    /**
     * Reports job progress in percent. Every report also counts as a liveness heartbeat.
     */
    @FunctionalInterface
    interface ProgressReporter {
        void report(int percentage);

        /**
         * Signals that the job is still alive without changing its progress, e.g. while waiting on a remote service.
         */
        default void heartbeat() {
        }
    }
}
