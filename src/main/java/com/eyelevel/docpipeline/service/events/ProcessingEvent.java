package com.eyelevel.docpipeline.service.events;

import com.eyelevel.docpipeline.model.JobType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Wire shape of a lifecycle notification.
 */
@Value
@Builder
public class ProcessingEvent {
    String event;
    String jobId;
    JobType jobType;
    String documentId;
    String documentName;
    String organizationId;
    Integer progress;
    Map<String, Object> result;
    String error;
    String timestamp;
}
