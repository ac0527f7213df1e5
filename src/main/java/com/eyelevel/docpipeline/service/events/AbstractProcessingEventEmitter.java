package com.eyelevel.docpipeline.service.events;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Builds {@link ProcessingEvent}s and hands them to {@link #publish(ProcessingEvent)}. A failing publish is
 * logged and dropped.
 */
@Slf4j
public abstract class AbstractProcessingEventEmitter implements ProcessingEventEmitter {

    private final Clock clock;

    protected AbstractProcessingEventEmitter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void emitStarted(JobEventSubject subject) {
        send(event(ProcessingEventType.STARTED, subject).build());
    }

    @Override
    public void emitProgress(JobEventSubject subject, int progress) {
        send(event(ProcessingEventType.PROGRESS, subject).progress(progress).build());
    }

    @Override
    public void emitCompleted(JobEventSubject subject, Map<String, Object> result) {
        send(event(ProcessingEventType.COMPLETED, subject).progress(100).result(result).build());
    }

    @Override
    public void emitFailed(JobEventSubject subject, String errorMessage) {
        send(event(ProcessingEventType.FAILED, subject).error(errorMessage).build());
    }

    protected abstract void publish(ProcessingEvent event) throws Exception;

    private ProcessingEvent.ProcessingEventBuilder event(ProcessingEventType type, JobEventSubject subject) {
        return ProcessingEvent.builder()
                .event(type.getEventName())
                .jobId(subject.jobId())
                .jobType(subject.jobType())
                .documentId(subject.documentId())
                .documentName(subject.documentName())
                .organizationId(subject.organizationId())
                .timestamp(Instant.now(clock).toString());
    }

    private void send(ProcessingEvent event) {
        try {
            publish(event);
        } catch (Exception e) {
            log.warn("[JobId: {}] Failed to emit '{}' event: {}", event.getJobId(), event.getEvent(), e.getMessage());
        }
    }
}
