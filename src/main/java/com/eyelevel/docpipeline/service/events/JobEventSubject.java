package com.eyelevel.docpipeline.service.events;

import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.model.ProcessingJob;
import com.eyelevel.docpipeline.service.queue.JobPayload;
import com.eyelevel.docpipeline.service.queue.QueueJob;

/**
 * The job and document an event is about. Built from the durable record when it is at hand, or from the
 * queue payload on hot paths such as progress reporting.
 */
public record JobEventSubject(String jobId, JobType jobType, String documentId, String documentName,
                              String organizationId) {

    public static JobEventSubject of(ProcessingJob job, Document document) {
        return new JobEventSubject(job.getId(), job.getJobType(), job.getDocumentId(),
                document != null ? document.getName() : null,
                document != null ? document.getOrganizationId() : null);
    }

    public static JobEventSubject of(QueueJob queueJob) {
        JobPayload payload = queueJob.getPayload();
        return new JobEventSubject(queueJob.getId(), payload.getJobType(), payload.getDocumentId(), null,
                payload.getOrganizationId());
    }
}
