package com.eyelevel.docpipeline.service.queue;

/**
 * Where job queues keep their messages.
 */
public enum QueueBackend {
    /**
     * One SQS queue per {@link QueueName}; jobs survive restarts and are shared by every instance.
     */
    SQS,
    /**
     * In-process queues for local runs; their content is lost with the process.
     */
    LOCAL
}
