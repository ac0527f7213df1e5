package com.eyelevel.docpipeline.service.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Default emitter: writes lifecycle events to the application log.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.events.sqs.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingProcessingEventEmitter extends AbstractProcessingEventEmitter {

    public LoggingProcessingEventEmitter(Clock clock) {
        super(clock);
    }

    @Override
    protected void publish(ProcessingEvent event) {
        if (ProcessingEventType.PROGRESS.getEventName().equals(event.getEvent())) {
            log.debug("[JobId: {}, DocumentId: {}] {} {}%", event.getJobId(), event.getDocumentId(), event.getEvent(),
                      event.getProgress());
            return;
        }
        log.info("[JobId: {}, DocumentId: {}] {} (type: {}, org: {}){}", event.getJobId(), event.getDocumentId(),
                 event.getEvent(), event.getJobType(), event.getOrganizationId(),
                 event.getError() != null ? " error: " + event.getError() : "");
    }
}
