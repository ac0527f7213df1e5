package com.eyelevel.docpipeline.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * One unit of processing work against a document.
 * <p>
 * The {@code id} is also the job key in the queue, so the queue entry and this record can always be
 * cross-checked.
 */
@Entity
@Table(name = "processing_jobs")
@Data
public class ProcessingJob {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(name = "document_id", nullable = false, length = 36)
    private String documentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status;

    @Column(nullable = false)
    private int priority;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts = 3;

    /**
     * Queue delivery attempts used by the current run. Lets an in-memory queue resume the run's retries after a
     * restart.
     */
    @Column(name = "delivery_attempts", columnDefinition = "integer not null default 0")
    private int deliveryAttempts;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "input_params", nullable = false)
    private Map<String, Object> inputParams = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_data")
    private Map<String, Object> outputData;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_stack", columnDefinition = "TEXT")
    private String errorStack;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_category")
    private ErrorCategory errorCategory;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
