package com.eyelevel.docpipeline.service.lifecycle;

import com.eyelevel.docpipeline.service.processor.JobDispatcher;
import com.eyelevel.docpipeline.service.queue.JobQueue;
import com.eyelevel.docpipeline.service.queue.ProcessingQueues;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Attaches the dispatcher and the lifecycle listener to every queue. A legacy SQS queue gets a worker too, so
 * messages an older producer still sends there are processed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueWorkerRegistrar {

    private final ProcessingQueues queues;
    private final JobDispatcher jobDispatcher;
    private final JobEventHandler jobEventHandler;

    @PostConstruct
    public void registerWorkers() {
        for (JobQueue queue : queues.all()) {
            queue.addListener(jobEventHandler);
            queue.setHandler(jobDispatcher);
            log.info("Worker registered for queue '{}'.", queue.getName().getValue());
        }
    }
}
