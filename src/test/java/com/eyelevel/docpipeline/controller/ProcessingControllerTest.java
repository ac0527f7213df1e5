package com.eyelevel.docpipeline.controller;

import com.eyelevel.docpipeline.dto.job.request.AddJobRequest;
import com.eyelevel.docpipeline.dto.job.response.AddJobResponse;
import com.eyelevel.docpipeline.dto.queue.response.CleanupResponse;
import com.eyelevel.docpipeline.dto.queue.response.DrainResponse;
import com.eyelevel.docpipeline.dto.queue.response.QueueStats;
import com.eyelevel.docpipeline.exception.JobConfigurationException;
import com.eyelevel.docpipeline.exception.JobStateException;
import com.eyelevel.docpipeline.exception.ResourceNotFoundException;
import com.eyelevel.docpipeline.exception.handler.GlobalExceptionHandler;
import com.eyelevel.docpipeline.service.ProcessingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ProcessingControllerTest {

    @Mock
    private ProcessingService processingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ProcessingController(processingService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void addJobIsAccepted() throws Exception {
        when(processingService.addJob(any(AddJobRequest.class))).thenReturn(AddJobResponse.builder()
                .jobId("job-1")
                .queueJobId("job-1")
                .queueName("ocr-queue")
                .build());

        mockMvc.perform(post("/processing/v1/jobs")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"documentId\": \"doc-1\", \"jobType\": \"OCR\", \"priority\": 1}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.statusCode").value(202))
                .andExpect(jsonPath("$.response.jobId").value("job-1"))
                .andExpect(jsonPath("$.response.queueName").value("ocr-queue"));

        ArgumentCaptor<AddJobRequest> request = ArgumentCaptor.forClass(AddJobRequest.class);
        verify(processingService).addJob(request.capture());
        assertEquals("doc-1", request.getValue().getDocumentId());
        assertEquals(1, request.getValue().getPriority());
    }

    @Test
    void addJobWithoutDocumentIsBadRequest() throws Exception {
        mockMvc.perform(post("/processing/v1/jobs")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"jobType\": \"OCR\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.showMessage").value(true));

        verifyNoInteractions(processingService);
    }

    @Test
    void unknownJobTypeIsBadRequest() throws Exception {
        when(processingService.addJob(any(AddJobRequest.class)))
                .thenThrow(new JobConfigurationException("Unknown job type: TRANSLATE"));

        mockMvc.perform(post("/processing/v1/jobs")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"documentId\": \"doc-1\", \"jobType\": \"TRANSLATE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.displayMessage").value("Unknown job type: TRANSLATE"));
    }

    @Test
    void missingJobIsNotFound() throws Exception {
        when(processingService.getJobStatus("nope"))
                .thenThrow(new ResourceNotFoundException("Processing job not found: nope"));

        mockMvc.perform(get("/processing/v1/jobs/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.displayMessage").value("Processing job not found: nope"));
    }

    @Test
    void refusedRetryIsConflict() throws Exception {
        when(processingService.retryJob("job-1"))
                .thenThrow(new JobStateException("Only failed jobs can be retried. Current status: RUNNING"));

        mockMvc.perform(post("/processing/v1/jobs/job-1/retry"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.statusCode").value(409));
    }

    @Test
    void pauseReturnsQueueStats() throws Exception {
        when(processingService.getQueueStatsByName("pdf-queue")).thenReturn(QueueStats.builder()
                .name("pdf-queue")
                .waiting(4)
                .paused(1)
                .build());

        mockMvc.perform(post("/processing/v1/queues/pdf-queue/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.paused").value(1))
                .andExpect(jsonPath("$.displayMessage").value("Queue paused."));

        verify(processingService).pauseQueue("pdf-queue");
    }

    @Test
    void drainReportsRemovedJobs() throws Exception {
        when(processingService.drainQueue("ocr-queue")).thenReturn(new DrainResponse("ocr-queue", 3));

        mockMvc.perform(delete("/processing/v1/queues/ocr-queue/drain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.removed").value(3))
                .andExpect(jsonPath("$.displayMessage").value("Removed 3 job(s) from ocr-queue."));
    }

    @Test
    void cleanupDefaultsToSevenDays() throws Exception {
        when(processingService.cleanOldJobs(7)).thenReturn(CleanupResponse.builder()
                .deletedRecords(2)
                .removedQueueJobs(5)
                .errors(List.of())
                .build());

        mockMvc.perform(post("/processing/v1/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.deletedRecords").value(2));
    }
}
