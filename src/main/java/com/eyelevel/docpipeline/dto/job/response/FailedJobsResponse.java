package com.eyelevel.docpipeline.dto.job.response;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class FailedJobsResponse {
    private final List<ProcessingJobResponse> jobs;
    private final long total;
    private final int limit;
    private final int offset;
}
