package com.eyelevel.docpipeline.dto.job.response;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AddJobResponse {
    private final String jobId;
    private final String queueJobId;
    private final String queueName;
}
