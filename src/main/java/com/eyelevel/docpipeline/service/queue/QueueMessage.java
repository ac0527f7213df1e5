package com.eyelevel.docpipeline.service.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a job message on an SQS-backed queue. A retry is a new message carrying the attempts used so far.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueueMessage {
    private String jobId;
    private String jobKind;
    private JobPayload payload;
    private int priority;
    private int attempts;
    private int attemptsMade;
    private long timestamp;
    /**
     * Epoch millis before which the job must not run; set when the wanted delay exceeds what SQS can hold.
     */
    private long notBefore;
}
