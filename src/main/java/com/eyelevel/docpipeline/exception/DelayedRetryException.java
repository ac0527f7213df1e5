package com.eyelevel.docpipeline.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Signals the queue to re-deliver the job after {@code retryAfterMs} without counting the failed run as an attempt.
 */
@Getter
public class DelayedRetryException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -8395003517961431047L;

    private final long retryAfterMs;

    public DelayedRetryException(String message, long retryAfterMs, Throwable cause) {
        super(message, cause);
        this.retryAfterMs = retryAfterMs;
    }
}
