package com.eyelevel.docpipeline.dto.queue.response;

import lombok.Builder;
import lombok.Getter;

/**
 * Job counts of one queue, or of all queues when used as a total.
 */
@Getter
@Builder
public class QueueStats {
    private final String name;
    private final long waiting;
    private final long active;
    private final long completed;
    private final long failed;
    private final long delayed;
    /**
     * Whether the queue is paused; in a total, the number of paused queues.
     */
    private final long paused;
}
