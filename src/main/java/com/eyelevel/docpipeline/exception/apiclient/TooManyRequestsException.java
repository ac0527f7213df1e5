package com.eyelevel.docpipeline.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Exception indicating that too many requests were made (HTTP 429).
 *
 * <p>Carries the server's {@code Retry-After} hint in seconds when one was sent.
 */
@Getter
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6576126133407459351L;

    private final Long retryAfterSeconds;

    public TooManyRequestsException(String message) {
        this(message, null);
    }

    public TooManyRequestsException(String message, Long retryAfterSeconds) {
        super(message, 429);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
