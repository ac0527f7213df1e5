package com.eyelevel.docpipeline.service.processor;

import com.eyelevel.docpipeline.model.JobType;

import java.util.Map;
import java.util.Set;

/**
 * Defines the contract for the domain logic bound to one family of job types.
 */
public interface JobProcessor {

    /**
     * The job types this processor executes. Each job type belongs to exactly one processor.
     */
    Set<JobType> supportedJobTypes();

    /**
     * Executes one delivered job.
     *
     * @param context the job being executed and its progress channel.
     * @return a structured summary of the result, persisted as the job's output data.
     * @throws Exception any failure; the caller decides whether the job is retried.
     */
    Map<String, Object> process(JobExecutionContext context) throws Exception;
}
