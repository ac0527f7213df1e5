package com.eyelevel.docpipeline.service.store;

import com.eyelevel.docpipeline.exception.ResourceNotFoundException;
import com.eyelevel.docpipeline.model.*;
import com.eyelevel.docpipeline.repository.DocumentRepository;
import com.eyelevel.docpipeline.repository.ProcessingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Consumer;

/**
 * {@link ProcessingStore} backed by Spring Data JPA.
 * <p>
 * Writes run in their own transaction so a status change is committed before the caller moves on,
 * independent of any surrounding transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaProcessingStore implements ProcessingStore {

    private final ProcessingJobRepository processingJobRepository;
    private final DocumentRepository documentRepository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ProcessingJob createJob(ProcessingJob job) {
        if (job.getId() == null) {
            job.setId(UUID.randomUUID().toString());
        }
        return processingJobRepository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProcessingJob> getJob(String jobId) {
        return processingJobRepository.findById(jobId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ProcessingJob updateJob(String jobId, Consumer<ProcessingJob> changes) {
        ProcessingJob job = processingJobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Processing job not found: " + jobId));
        changes.accept(job);
        return processingJobRepository.save(job);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int deleteJobsOlderThan(Collection<JobStatus> statuses, LocalDateTime completedBefore) {
        int deleted = processingJobRepository.deleteFinishedBefore(statuses, completedBefore);
        log.debug("Deleted {} processing jobs in {} completed before {}", deleted, statuses, completedBefore);
        return deleted;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProcessingJob> findJobsByDocument(String documentId) {
        return processingJobRepository.findAllByDocumentIdOrderByCreatedAtDesc(documentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProcessingJob> findJobsByStatus(JobStatus status) {
        return processingJobRepository.findAllByStatusOrderByCreatedAtAsc(status);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsActiveJob(String documentId, JobType jobType) {
        return processingJobRepository.existsByDocumentIdAndJobTypeAndStatusIn(documentId, jobType,
                JobStatus.ACTIVE_STATUSES);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProcessingJob> findFailedJobs(int limit, int offset) {
        return processingJobRepository.findPageByStatus(JobStatus.FAILED.name(), limit, offset);
    }

    @Override
    @Transactional(readOnly = true)
    public long countJobsByStatus(JobStatus status) {
        return processingJobRepository.countByStatus(status);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Document> getDocument(String documentId) {
        return documentRepository.findById(documentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Document> getDocuments(Collection<String> documentIds) {
        return documentRepository.findAllById(documentIds);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Document updateDocument(String documentId, Consumer<Document> changes) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new ResourceNotFoundException("Document not found: " + documentId));
        changes.accept(document);
        return documentRepository.save(document);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Document createDocument(Document document) {
        if (document.getId() == null) {
            document.setId(UUID.randomUUID().toString());
        }
        return documentRepository.save(document);
    }
}
