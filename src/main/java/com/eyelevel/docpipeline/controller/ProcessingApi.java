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
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Processing Pipeline", description = "Endpoints for queuing processing jobs, following their status and operating the job queues.")
public interface ProcessingApi {

    @Operation(summary = "Add Processing Job",
            description = "Creates a processing job for a document and enqueues it on the queue its job type routes to.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Job created and queued.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Processing job queued successfully.",
                                        "response": {
                                            "jobId": "b5e1d7a2-4c3f-4e8b-9a61-2f0d8c7e5b14",
                                            "queueJobId": "b5e1d7a2-4c3f-4e8b-9a61-2f0d8c7e5b14",
                                            "queueName": "ocr-queue"
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unknown job type or invalid options.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The document does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<AddJobResponse>> addJob(@Valid @RequestBody AddJobRequest request);

    @Operation(summary = "Get Job Status",
            description = "Returns the job record, with its queue state and progress while the queue still holds it.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The job does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProcessingJobResponse>> getJobStatus(
            @Parameter(description = "The processing job ID.", required = true) @PathVariable("jobId") String jobId);

    @Operation(summary = "Retry Failed Job",
            description = "Re-enqueues a FAILED job under the same ID. Refused when the job is not FAILED or has no attempts left.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Job re-queued.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The job does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job cannot be retried in its current state.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<AddJobResponse>> retryJob(
            @Parameter(description = "The processing job ID.", required = true) @PathVariable("jobId") String jobId);

    @Operation(summary = "Cancel Pending Job",
            description = "Cancels a PENDING job and removes it from its queue. Running jobs cannot be cancelled.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job cancelled.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job is not pending.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProcessingJobResponse>> cancelJob(
            @Parameter(description = "The processing job ID.", required = true) @PathVariable("jobId") String jobId);

    @Operation(summary = "List Failed Jobs", description = "Returns a page of FAILED jobs, most recently finished first.")
    ResponseEntity<ApiResponse<FailedJobsResponse>> getFailedJobs(
            @Parameter(description = "Page size, 1 to 100.", example = "20") @RequestParam(value = "limit", defaultValue = "20") int limit,
            @Parameter(description = "Number of jobs to skip.", example = "0") @RequestParam(value = "offset", defaultValue = "0") int offset);

    @Operation(summary = "List Document Jobs", description = "Returns every processing job of a document, newest first.")
    ResponseEntity<ApiResponse<List<ProcessingJobResponse>>> getJobsByDocument(
            @Parameter(description = "The document ID.", required = true) @PathVariable("documentId") String documentId);

    @Operation(summary = "List Queues", description = "Returns the name and purpose of every registered queue.")
    ResponseEntity<ApiResponse<List<QueueInfo>>> getQueues();

    @Operation(summary = "Get Queue Statistics",
            description = "Returns job counts per state for every queue, plus the totals across all queues.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Statistics retrieved successfully.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Queue statistics retrieved successfully.",
                                        "response": {
                                            "queues": [
                                                { "name": "ocr-queue", "waiting": 5, "active": 2, "completed": 100, "failed": 3, "delayed": 1, "paused": 0 }
                                            ],
                                            "totals": { "name": "total", "waiting": 5, "active": 2, "completed": 100, "failed": 3, "delayed": 1, "paused": 0 }
                                        },
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """)))
    })
    ResponseEntity<ApiResponse<QueueStatsOverview>> getQueueStats();

    @Operation(summary = "Get Statistics Of One Queue")
    ResponseEntity<ApiResponse<QueueStats>> getQueueStatsByName(
            @Parameter(description = "The queue name.", required = true, example = "ocr-queue") @PathVariable("queueName") String queueName);

    @Operation(summary = "Pause Queue", description = "Stops dispatching new jobs. Jobs already running finish.")
    ResponseEntity<ApiResponse<QueueStats>> pauseQueue(
            @Parameter(description = "The queue name.", required = true, example = "ocr-queue") @PathVariable("queueName") String queueName);

    @Operation(summary = "Resume Queue")
    ResponseEntity<ApiResponse<QueueStats>> resumeQueue(
            @Parameter(description = "The queue name.", required = true, example = "ocr-queue") @PathVariable("queueName") String queueName);

    @Operation(summary = "Drain Queue",
            description = "Removes every waiting and delayed job from a queue. Jobs claimed by a worker meanwhile are left alone.")
    ResponseEntity<ApiResponse<DrainResponse>> drainQueue(
            @Parameter(description = "The queue name.", required = true, example = "ocr-queue") @PathVariable("queueName") String queueName);

    @Operation(summary = "Clean Old Jobs",
            description = "Deletes finished job records older than the given number of days and prunes finished queue entries.")
    ResponseEntity<ApiResponse<CleanupResponse>> cleanOldJobs(
            @Parameter(description = "Age threshold in days.", example = "7") @RequestParam(value = "olderThanDays", defaultValue = "7") int olderThanDays);
}
