package com.eyelevel.docpipeline.model;

/**
 * Failure classes that decide how a failed job is retried.
 */
public enum ErrorCategory {
    /**
     * Network or timeout failures. Retried by the queue's attempt and backoff policy.
     */
    TRANSIENT,
    /**
     * Bad input, missing resources or rejected credentials. Never retried.
     */
    PERMANENT,
    /**
     * Throttled by an external service. Re-delivered after a delay without consuming an attempt.
     */
    RATE_LIMITED,
    /**
     * Anything unrecognised. Treated like {@link #TRANSIENT}.
     */
    UNKNOWN
}
