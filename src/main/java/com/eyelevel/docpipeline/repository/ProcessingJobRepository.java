package com.eyelevel.docpipeline.repository;

import com.eyelevel.docpipeline.model.JobStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.model.ProcessingJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link ProcessingJob} entity.
 * Named queries are defined in META-INF/processing-job-orm.xml.
 */
@Repository
public interface ProcessingJobRepository extends JpaRepository<ProcessingJob, String> {

    List<ProcessingJob> findAllByDocumentIdOrderByCreatedAtDesc(String documentId);

    boolean existsByDocumentIdAndJobTypeAndStatusIn(String documentId, JobType jobType, Collection<JobStatus> statuses);

    List<ProcessingJob> findAllByStatusOrderByCreatedAtAsc(JobStatus status);

    long countByStatus(JobStatus status);

    @Query(name = "ProcessingJob.findPageByStatus", nativeQuery = true)
    List<ProcessingJob> findPageByStatus(@Param("status") String status, @Param("limit") int limit,
                                         @Param("offset") int offset);

    @Modifying
    @Query(name = "ProcessingJob.deleteFinishedBefore")
    int deleteFinishedBefore(@Param("statuses") Collection<JobStatus> statuses,
                             @Param("cutoff") LocalDateTime cutoff);
}
