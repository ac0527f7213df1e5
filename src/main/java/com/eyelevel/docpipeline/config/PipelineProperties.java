package com.eyelevel.docpipeline.config;

import com.eyelevel.docpipeline.service.queue.QueueBackend;
import com.eyelevel.docpipeline.service.queue.QueueName;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Binds application properties under the "app.processing" prefix: queue limits, retry and retention
 * defaults, and the tunables of each processor.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class PipelineProperties {

    private Queues queues = new Queues();
    private RetryConfig retry = new RetryConfig();
    private Retention retention = new Retention();
    private long stalledIntervalMs = 120_000;
    private Ocr ocr = new Ocr();
    private Embedding embedding = new Embedding();
    private AiClassify aiClassify = new AiClassify();
    private Thumbnail thumbnail = new Thumbnail();
    private Pdf pdf = new Pdf();

    @Data
    public static class RetryConfig {
        private int attempts = 3;
        private long delayMs = 2000;
    }

    @Data
    public static class RateLimit {
        /**
         * Jobs allowed per {@link #durationMs}; zero disables the limit.
         */
        private int max;
        private long durationMs = 60_000;
    }

    @Data
    public static class QueueProperties {
        private int concurrency = 1;
        private RateLimit rateLimit = new RateLimit();
        /**
         * SQS queue name or URL; defaults to the queue's own name.
         */
        private String sqsQueue;

        static QueueProperties of(int concurrency, int rateLimitMax) {
            QueueProperties properties = new QueueProperties();
            properties.setConcurrency(concurrency);
            properties.getRateLimit().setMax(rateLimitMax);
            return properties;
        }
    }

    @Data
    public static class Queues {
        private QueueBackend backend = QueueBackend.SQS;
        private boolean legacyEnabled = true;
        private int pollTimeoutSeconds = 10;
        private QueueProperties ocr = QueueProperties.of(2, 10);
        private QueueProperties pdf = QueueProperties.of(5, 0);
        private QueueProperties thumbnail = QueueProperties.of(10, 0);
        private QueueProperties embedding = QueueProperties.of(3, 60);
        private QueueProperties aiClassify = QueueProperties.of(2, 20);
        private QueueProperties legacy = QueueProperties.of(1, 0);

        public QueueProperties forQueue(QueueName name) {
            return switch (name) {
                case OCR -> ocr;
                case PDF -> pdf;
                case THUMBNAIL -> thumbnail;
                case EMBEDDING -> embedding;
                case AI_CLASSIFY -> aiClassify;
                case LEGACY -> legacy;
            };
        }

        public String sqsQueueFor(QueueName name) {
            String configured = forQueue(name).getSqsQueue();
            return configured == null || configured.isBlank() ? name.getValue() : configured;
        }
    }

    @Data
    public static class Retention {
        private long completedAgeMs = 7L * 24 * 3600 * 1000;
        private int completedCount = 10_000;
        private long failedAgeMs = 30L * 24 * 3600 * 1000;
        private int failedCount = 5_000;
    }

    @Data
    public static class Ocr {
        private long pollIntervalMs = 5_000;
        private long maxPollIntervalMs = 30_000;
        private long maxWaitMs = 300_000;
        private long asyncThresholdBytes = 5L * 1024 * 1024;
        private long maxFileSizeBytes = 500L * 1024 * 1024;
        private List<String> supportedMimeTypes = List.of("application/pdf", "image/png", "image/jpeg", "image/tiff");
    }

    @Data
    public static class Embedding {
        private String model = "text-embedding-3-small";
        private int maxTokens = 8191;
        private int dimensions = 1536;
        private int batchSize = 2048;
    }

    @Data
    public static class AiClassify {
        private String model = "gpt-4-turbo-preview";
        private int maxTextLength = 4000;
        private double temperature = 0.3;
        private int maxResponseTokens = 500;
        private List<String> categories = List.of("Invoice", "Contract", "Report", "Letter", "Receipt", "Form",
                "Presentation", "Spreadsheet", "Image", "Other");
    }

    @Data
    public static class Thumbnail {
        private long maxFileSizeBytes = 50L * 1024 * 1024;
        private String defaultSize = "medium";
    }

    @Data
    public static class Pdf {
        private long maxFileSizeBytes = 100L * 1024 * 1024;
        private int maxPages = 1000;
        private int maxMergeDocuments = 50;
        private int renderDpi = 150;
        private Ghostscript ghostscript = new Ghostscript();

        @Data
        public static class Ghostscript {
            private boolean enabled;
            private String executable = "gs";
            /**
             * -dPDFSETTINGS preset used when a job does not ask for a quality.
             */
            private String preset = "/ebook";
            private long timeoutMinutes = 5;
            private RetryConfig retry = new RetryConfig();
        }
    }
}
