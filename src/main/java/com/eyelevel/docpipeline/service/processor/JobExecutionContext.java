package com.eyelevel.docpipeline.service.processor;

import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.service.queue.JobHandler.ProgressReporter;
import com.eyelevel.docpipeline.service.queue.JobPayload;
import com.eyelevel.docpipeline.service.queue.QueueJob;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * A delivered job as seen by a processor: its identity, payload and a progress channel that only moves forward.
 */
public class JobExecutionContext implements ProgressReporter {

    @Getter
    private final String jobId;
    @Getter
    private final int attemptsMade;
    private final JobPayload payload;
    private final ProgressReporter progressReporter;
    @Getter
    private int progress;

    public JobExecutionContext(QueueJob queueJob, ProgressReporter progressReporter) {
        this.jobId = queueJob.getId();
        this.attemptsMade = queueJob.getAttemptsMade();
        this.payload = queueJob.getPayload();
        this.progressReporter = progressReporter;
    }

    public String getDocumentId() {
        return payload.getDocumentId();
    }

    public String getS3Key() {
        return payload.getS3Key();
    }

    public String getOrganizationId() {
        return payload.getOrganizationId();
    }

    public JobType getJobType() {
        return payload.getJobType();
    }

    public Map<String, Object> getOptions() {
        return payload.getOptions() == null ? Collections.emptyMap() : payload.getOptions();
    }

    /**
     * Reports progress clamped to [0, 100]. Values not above the last reported one are ignored.
     */
    public void reportProgress(int percentage) {
        int clamped = Math.max(0, Math.min(100, percentage));
        if (clamped <= progress) {
            return;
        }
        progress = clamped;
        progressReporter.report(clamped);
    }

    @Override
    public void report(int percentage) {
        reportProgress(percentage);
    }

    /**
     * Keeps the job alive in its queue while progress cannot move, e.g. during a long remote wait.
     */
    @Override
    public void heartbeat() {
        progressReporter.heartbeat();
    }

    /**
     * Log prefix for this job.
     */
    public String getContextInfo() {
        return String.format("JobId: %s, DocumentId: %s", jobId, getDocumentId());
    }
}
