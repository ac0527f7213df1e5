package com.eyelevel.docpipeline.service.queue;

/**
 * Number of jobs per state held by one queue.
 */
public record JobCounts(long waiting, long active, long completed, long failed, long delayed) {
}
