package com.eyelevel.docpipeline.scheduler;

import com.eyelevel.docpipeline.dto.queue.response.CleanupResponse;
import com.eyelevel.docpipeline.service.ProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly sweep of finished job records and finished queue entries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessingJobCleanupScheduler {

    private final ProcessingService processingService;

    @Value("${app.scheduler.job-cleanup-retention-days:7}")
    private int retentionDays;

    @Scheduled(cron = "${app.scheduler.job-cleanup:0 0 3 * * *}")
    public void cleanOldJobs() {
        log.info("Running processing job cleanup for jobs older than {} day(s).", retentionDays);
        CleanupResponse result = processingService.cleanOldJobs(retentionDays);
        if (!result.getErrors().isEmpty()) {
            log.warn("Processing job cleanup finished with {} queue error(s): {}", result.getErrors().size(),
                     result.getErrors());
        }
        log.info("Finished processing job cleanup. Deleted {} record(s), removed {} queue entr(ies).",
                 result.getDeletedRecords(), result.getRemovedQueueJobs());
    }
}
