package com.eyelevel.docpipeline.service.processor.ocr;

import com.eyelevel.docpipeline.common.time.Sleeper;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.service.queue.JobHandler.ProgressReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Waits for an asynchronous OCR analysis with bounded exponential backoff.
 * <p>
 * The interval starts at {@code pollIntervalMs} and grows by half after every unfinished poll, up to
 * {@code maxPollIntervalMs}. Progress after poll n is {@code min(20 + 5n, 70)}, and every unfinished poll also
 * sends a heartbeat so a long analysis is not taken for a stalled job once progress reaches its cap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OcrJobPoller {

    private static final double BACKOFF_MULTIPLIER = 1.5;
    private static final int PROGRESS_BASE = 20;
    private static final int PROGRESS_STEP = 5;
    private static final int PROGRESS_CAP = 70;

    private final OcrEngine ocrEngine;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * @throws ProcessingException with a timeout message when no terminal result arrives within {@code maxWaitMs}.
     */
    public OcrResult awaitCompletion(String externalJobId, ProgressReporter progress) throws InterruptedException {
        PipelineProperties.Ocr config = properties.getOcr();
        long startTime = clock.millis();
        long interval = config.getPollIntervalMs();
        int pollCount = 0;

        while (clock.millis() - startTime < config.getMaxWaitMs()) {
            Optional<OcrResult> result = ocrEngine.getDocumentAnalysis(externalJobId);
            if (result.isPresent()) {
                log.debug("Textract job {} finished after {} poll(s).", externalJobId, pollCount + 1);
                return result.get();
            }
            pollCount++;
            progress.report(Math.min(PROGRESS_BASE + pollCount * PROGRESS_STEP, PROGRESS_CAP));
            progress.heartbeat();
            sleeper.sleep(interval);
            interval = Math.min((long) (interval * BACKOFF_MULTIPLIER), config.getMaxPollIntervalMs());
        }

        throw new ProcessingException(String.format("Textract job %s timeout: no result within %dms",
                externalJobId, config.getMaxWaitMs()));
    }
}
