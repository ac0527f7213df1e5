package com.eyelevel.docpipeline.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A stored document. The pipeline only writes the processing fields: {@code processingStatus},
 * {@code extractedText}, {@code thumbnailKey}, {@code contentVector} and namespaced entries of {@code metadata}.
 */
@Entity
@Table(name = "documents")
@Data
public class Document {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 36)
    private String organizationId;

    @Column(name = "folder_id", length = 36)
    private String folderId;

    @Column(nullable = false)
    private String name;

    @Column(name = "original_name")
    private String originalName;

    @Column(name = "mime_type", nullable = false, length = 127)
    private String mimeType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "s3_key", nullable = false, length = 1024)
    private String s3Key;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentStatus status = DocumentStatus.UPLOADED;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false)
    private DocumentProcessingStatus processingStatus = DocumentProcessingStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "extracted_text", columnDefinition = "TEXT")
    private String extractedText;

    @Column(name = "thumbnail_key", length = 1024)
    private String thumbnailKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "content_vector")
    private List<Double> contentVector;

    @Column(name = "created_by_id", length = 36)
    private String createdById;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Replaces one namespaced entry of the metadata, e.g. {@code ocr} or {@code aiClassification}.
     * A new map is assigned so the JSON column is always detected as changed.
     */
    public void putMetadata(String namespace, Object value) {
        Map<String, Object> updated = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        updated.put(namespace, value);
        this.metadata = updated;
    }
}
