package com.eyelevel.docpipeline.dto.queue.response;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of a cleanup sweep. Queue pruning errors are reported here rather than thrown.
 */
@Getter
@Builder
public class CleanupResponse {
    private final int deletedRecords;
    private final int removedQueueJobs;
    private final List<String> errors;
}
