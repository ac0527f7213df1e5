package com.eyelevel.docpipeline.service.processor;

import com.eyelevel.docpipeline.exception.UnrecoverableJobException;
import com.eyelevel.docpipeline.service.queue.JobHandler;
import com.eyelevel.docpipeline.service.queue.QueueJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The handler installed on every queue: hands each delivered job to the processor registered for its type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDispatcher implements JobHandler {

    private final JobProcessorRegistry registry;

    @Override
    public Map<String, Object> handle(QueueJob job, ProgressReporter progress) throws Exception {
        JobProcessor processor = registry.getProcessor(job.getPayload().getJobType())
                .orElseThrow(() -> new UnrecoverableJobException(
                        "No processor registered for job type: " + job.getPayload().getJobType(), null));
        log.debug("[JobId: {}] Dispatching '{}' to {}", job.getId(), job.getName(),
                  processor.getClass().getSimpleName());
        return processor.process(new JobExecutionContext(job, progress));
    }
}
