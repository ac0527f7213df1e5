package com.eyelevel.docpipeline.service.queue;

import lombok.Builder;
import lombok.Data;

/**
 * Per-job delivery options. Unset values fall back to the queue's defaults.
 */
@Data
@Builder
public class JobOptions {
    /**
     * Queue job key. Adding a key that is still waiting, delayed or active is a no-op.
     */
    private String jobId;
    private Integer priority;
    private Long delayMs;
    private Integer attempts;
    /**
     * Attempts already used, e.g. when a run is restored after a restart.
     */
    private Integer attemptsMade;
    private boolean removeOnComplete;
    private boolean removeOnFail;
}
