package com.eyelevel.docpipeline.service.queue;

import com.eyelevel.docpipeline.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Data carried by a queued job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPayload {
    private String documentId;
    private String s3Key;
    private String organizationId;
    private JobType jobType;
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();
}
