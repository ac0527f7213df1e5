package com.eyelevel.docpipeline.controller;

import com.eyelevel.docpipeline.dto.common.ApiResponse;
import com.eyelevel.docpipeline.dto.job.request.AddJobRequest;
import com.eyelevel.docpipeline.dto.job.response.AddJobResponse;
import com.eyelevel.docpipeline.dto.job.response.FailedJobsResponse;
import com.eyelevel.docpipeline.dto.job.response.ProcessingJobResponse;
import com.eyelevel.docpipeline.dto.queue.response.CleanupResponse;
import com.eyelevel.docpipeline.dto.queue.response.DrainResponse;
import com.eyelevel.docpipeline.dto.queue.response.QueueInfo;
import com.eyelevel.docpipeline.dto.queue.response.QueueStats;
import com.eyelevel.docpipeline.dto.queue.response.QueueStatsOverview;
import com.eyelevel.docpipeline.service.ProcessingService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST surface over {@link ProcessingService}: jobs and queues. All responses use the {@link ApiResponse}
 * envelope.
 */
@Slf4j
@RestController
@RequestMapping("/processing")
@RequiredArgsConstructor
@Validated
public class ProcessingController implements ProcessingApi {

    private final ProcessingService processingService;

    // --- JOBS ---

    @Override
    @PostMapping("/v1/jobs")
    public ResponseEntity<ApiResponse<AddJobResponse>> addJob(@Valid @RequestBody final AddJobRequest request) {
        log.info("Adding {} job for document {}", request.getJobType(), request.getDocumentId());
        AddJobResponse responseData = processingService.addJob(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success("Processing job queued successfully.", responseData,
                                          HttpStatus.ACCEPTED.value()));
    }

    @Override
    @GetMapping("/v1/jobs/{jobId}")
    public ResponseEntity<ApiResponse<ProcessingJobResponse>> getJobStatus(@PathVariable("jobId") final String jobId) {
        return ResponseEntity.ok(ApiResponse.success(null, processingService.getJobStatus(jobId),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/jobs/{jobId}/retry")
    public ResponseEntity<ApiResponse<AddJobResponse>> retryJob(@PathVariable("jobId") final String jobId) {
        log.info("Retry requested for job {}", jobId);
        AddJobResponse responseData = processingService.retryJob(jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success("Job has been re-queued for processing.", responseData,
                                          HttpStatus.ACCEPTED.value()));
    }

    @Override
    @DeleteMapping("/v1/jobs/{jobId}")
    public ResponseEntity<ApiResponse<ProcessingJobResponse>> cancelJob(@PathVariable("jobId") final String jobId) {
        log.info("Cancellation requested for job {}", jobId);
        ProcessingJobResponse responseData = processingService.cancelJob(jobId);
        return ResponseEntity.ok(ApiResponse.success("Job cancelled successfully.", responseData,
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/jobs/failed")
    public ResponseEntity<ApiResponse<FailedJobsResponse>> getFailedJobs(
            @RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(100) final int limit,
            @RequestParam(value = "offset", defaultValue = "0") @PositiveOrZero final int offset) {
        return ResponseEntity.ok(ApiResponse.success(null, processingService.getFailedJobs(limit, offset),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/documents/{documentId}/jobs")
    public ResponseEntity<ApiResponse<List<ProcessingJobResponse>>> getJobsByDocument(
            @PathVariable("documentId") final String documentId) {
        return ResponseEntity.ok(ApiResponse.success(null, processingService.getJobsByDocument(documentId),
                                                     HttpStatus.OK.value()));
    }

    // --- QUEUES ---

    @Override
    @GetMapping("/v1/queues")
    public ResponseEntity<ApiResponse<List<QueueInfo>>> getQueues() {
        return ResponseEntity.ok(ApiResponse.success(null, processingService.getQueues(), HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/queues/stats")
    public ResponseEntity<ApiResponse<QueueStatsOverview>> getQueueStats() {
        return ResponseEntity.ok(ApiResponse.success(null, processingService.getQueueStats(),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/queues/{queueName}/stats")
    public ResponseEntity<ApiResponse<QueueStats>> getQueueStatsByName(
            @PathVariable("queueName") final String queueName) {
        return ResponseEntity.ok(ApiResponse.success(null, processingService.getQueueStatsByName(queueName),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/queues/{queueName}/pause")
    public ResponseEntity<ApiResponse<QueueStats>> pauseQueue(@PathVariable("queueName") final String queueName) {
        processingService.pauseQueue(queueName);
        return ResponseEntity.ok(ApiResponse.success("Queue paused.",
                                                     processingService.getQueueStatsByName(queueName),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/queues/{queueName}/resume")
    public ResponseEntity<ApiResponse<QueueStats>> resumeQueue(@PathVariable("queueName") final String queueName) {
        processingService.resumeQueue(queueName);
        return ResponseEntity.ok(ApiResponse.success("Queue resumed.",
                                                     processingService.getQueueStatsByName(queueName),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @DeleteMapping("/v1/queues/{queueName}/drain")
    public ResponseEntity<ApiResponse<DrainResponse>> drainQueue(@PathVariable("queueName") final String queueName) {
        log.info("Drain requested for queue {}", queueName);
        DrainResponse responseData = processingService.drainQueue(queueName);
        return ResponseEntity.ok(ApiResponse.success(
                String.format("Removed %d job(s) from %s.", responseData.removed(), queueName), responseData,
                HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/cleanup")
    public ResponseEntity<ApiResponse<CleanupResponse>> cleanOldJobs(
            @RequestParam(value = "olderThanDays", defaultValue = "7") @PositiveOrZero final int olderThanDays) {
        log.info("Cleanup requested for jobs older than {} day(s)", olderThanDays);
        CleanupResponse responseData = processingService.cleanOldJobs(olderThanDays);
        return ResponseEntity.ok(ApiResponse.success("Cleanup finished.", responseData, HttpStatus.OK.value()));
    }
}
