package com.eyelevel.docpipeline.service.queue;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a job held by a {@link JobQueue}.
 */
@Value
@Builder(toBuilder = true)
public class QueueJob {
    String id;
    String name;
    JobPayload payload;
    int priority;
    int attempts;
    int attemptsMade;
    QueueJobState state;
    int progress;
    Map<String, Object> returnValue;
    String failedReason;
    long timestamp;
    Long processedOn;
    Long finishedOn;
}
