package com.eyelevel.docpipeline.dto.job.response;

import com.eyelevel.docpipeline.model.ErrorCategory;
import com.eyelevel.docpipeline.model.JobStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.model.ProcessingJob;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A processing job as reported to callers. Queue fields are only set when the job was looked up in its queue.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessingJobResponse {
    private final String id;
    private final String documentId;
    private final JobType jobType;
    private final JobStatus status;
    private final int priority;
    private final int attempts;
    private final int maxAttempts;
    private final Map<String, Object> inputParams;
    private final Map<String, Object> outputData;
    private final String errorMessage;
    private final ErrorCategory errorCategory;
    private final LocalDateTime createdAt;
    private final LocalDateTime startedAt;
    private final LocalDateTime completedAt;

    private final String queueName;
    private final String queueState;
    private final Integer progress;

    public static ProcessingJobResponse from(ProcessingJob job) {
        return ProcessingJobResponse.builder()
                .id(job.getId())
                .documentId(job.getDocumentId())
                .jobType(job.getJobType())
                .status(job.getStatus())
                .priority(job.getPriority())
                .attempts(job.getAttempts())
                .maxAttempts(job.getMaxAttempts())
                .inputParams(job.getInputParams())
                .outputData(job.getOutputData())
                .errorMessage(job.getErrorMessage())
                .errorCategory(job.getErrorCategory())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
