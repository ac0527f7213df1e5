package com.eyelevel.docpipeline.service.events;

import java.util.Map;

/**
 * One-way notifier for job lifecycle transitions. Implementations never throw and never block processing
 * on delivery.
 */
public interface ProcessingEventEmitter {

    void emitStarted(JobEventSubject subject);

    void emitProgress(JobEventSubject subject, int progress);

    void emitCompleted(JobEventSubject subject, Map<String, Object> result);

    void emitFailed(JobEventSubject subject, String errorMessage);
}
