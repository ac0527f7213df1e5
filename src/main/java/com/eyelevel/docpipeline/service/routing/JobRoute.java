package com.eyelevel.docpipeline.service.routing;

import com.eyelevel.docpipeline.service.queue.QueueName;

/**
 * Where a job type is delivered.
 *
 * @param queue           the target queue.
 * @param jobKind         the queue-specific job name.
 * @param defaultPriority priority used when the caller gives none; lower is more urgent.
 */
public record JobRoute(QueueName queue, String jobKind, int defaultPriority) {
}
