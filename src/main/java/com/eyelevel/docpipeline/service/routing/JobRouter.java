package com.eyelevel.docpipeline.service.routing;

import com.eyelevel.docpipeline.exception.JobConfigurationException;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.service.queue.QueueName;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps a {@link JobType} to its queue, job kind label and default priority.
 * <p>
 * All PDF sub-operations share the PDF queue, every other type has a dedicated queue.
 */
@Component
public class JobRouter {

    public static final int PRIORITY_HIGH = 2;
    public static final int PRIORITY_NORMAL = 3;
    public static final int PRIORITY_LOW = 4;

    public JobRoute route(JobType jobType) {
        if (jobType == null) {
            throw new JobConfigurationException("Job type must not be null");
        }
        return switch (jobType) {
            case OCR -> new JobRoute(QueueName.OCR, "ocr-document", PRIORITY_NORMAL);
            case THUMBNAIL -> new JobRoute(QueueName.THUMBNAIL, "generate-thumbnail", PRIORITY_HIGH);
            case EMBEDDING -> new JobRoute(QueueName.EMBEDDING, "generate-embedding", PRIORITY_LOW);
            case AI_CLASSIFY -> new JobRoute(QueueName.AI_CLASSIFY, "classify-document", PRIORITY_NORMAL);
            case PDF_RENDER_PAGE, PDF_METADATA -> pdfRoute(jobType, PRIORITY_NORMAL);
            case PDF_SPLIT, PDF_MERGE, PDF_WATERMARK, PDF_COMPRESS, PDF_EXTRACT_PAGES -> pdfRoute(jobType, PRIORITY_LOW);
        };
    }

    /**
     * Resolves a job type by name and routes it.
     *
     * @throws JobConfigurationException if the name is not a known job type.
     */
    public JobRoute route(String jobTypeName) {
        return route(resolveJobType(jobTypeName));
    }

    public JobType resolveJobType(String jobTypeName) {
        if (jobTypeName == null || jobTypeName.isBlank()) {
            throw new JobConfigurationException("Job type must not be blank");
        }
        try {
            return JobType.valueOf(jobTypeName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException("Unknown job type: " + jobTypeName);
        }
    }

    private static JobRoute pdfRoute(JobType jobType, int priority) {
        return new JobRoute(QueueName.PDF, jobType.name().toLowerCase(Locale.ROOT), priority);
    }
}
