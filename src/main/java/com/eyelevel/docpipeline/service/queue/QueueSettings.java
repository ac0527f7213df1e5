package com.eyelevel.docpipeline.service.queue;

import lombok.Builder;
import lombok.Value;

/**
 * Effective configuration of one {@link JobQueue}.
 */
@Value
@Builder
public class QueueSettings {
    @Builder.Default
    int concurrency = 1;
    /**
     * Dispatches allowed per {@link #rateLimitDurationMs}; zero disables rate limiting.
     */
    int rateLimitMax;
    long rateLimitDurationMs;
    @Builder.Default
    int defaultAttempts = 3;
    @Builder.Default
    long backoffMs = 2000;
    @Builder.Default
    long completedRetentionMs = 7L * 24 * 3600 * 1000;
    @Builder.Default
    int completedRetentionCount = 10_000;
    @Builder.Default
    long failedRetentionMs = 30L * 24 * 3600 * 1000;
    @Builder.Default
    int failedRetentionCount = 5_000;
    /**
     * An active job without a heartbeat for this long is stalled and moved back to waiting; zero disables the check.
     */
    long stalledIntervalMs;
    /**
     * Stalls a job may survive; the next one fails it.
     */
    @Builder.Default
    int maxStalledCount = 1;
}
