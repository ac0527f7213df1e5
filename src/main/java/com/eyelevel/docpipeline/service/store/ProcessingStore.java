package com.eyelevel.docpipeline.service.store;

import com.eyelevel.docpipeline.model.*;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable record store for processing jobs and the documents they act on.
 * It is the single source of truth for job status.
 */
public interface ProcessingStore {

    /**
     * Persists a new job. An id is assigned when the job has none.
     */
    ProcessingJob createJob(ProcessingJob job);

    Optional<ProcessingJob> getJob(String jobId);

    /**
     * Applies {@code changes} to the stored job and persists the result.
     *
     * @throws com.eyelevel.docpipeline.exception.ResourceNotFoundException if the job does not exist.
     */
    ProcessingJob updateJob(String jobId, Consumer<ProcessingJob> changes);

    /**
     * Deletes jobs in one of {@code statuses} that completed before {@code completedBefore}.
     *
     * @return the number of deleted jobs.
     */
    int deleteJobsOlderThan(Collection<JobStatus> statuses, LocalDateTime completedBefore);

    List<ProcessingJob> findJobsByDocument(String documentId);

    List<ProcessingJob> findJobsByStatus(JobStatus status);

    /**
     * Whether the document has a PENDING or RUNNING job of the given type.
     */
    boolean existsActiveJob(String documentId, JobType jobType);

    /**
     * Failed jobs, most recently failed first.
     */
    List<ProcessingJob> findFailedJobs(int limit, int offset);

    long countJobsByStatus(JobStatus status);

    Optional<Document> getDocument(String documentId);

    List<Document> getDocuments(Collection<String> documentIds);

    /**
     * Applies {@code changes} to the stored document and persists the result.
     *
     * @throws com.eyelevel.docpipeline.exception.ResourceNotFoundException if the document does not exist.
     */
    Document updateDocument(String documentId, Consumer<Document> changes);

    /**
     * Persists a document produced by the pipeline, e.g. a split or merge output.
     */
    Document createDocument(Document document);
}
