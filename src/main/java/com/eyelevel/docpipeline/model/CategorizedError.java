package com.eyelevel.docpipeline.model;

/**
 * The outcome of classifying a raw failure.
 *
 * @param category     the failure class driving the retry decision.
 * @param message      the human-readable message persisted on the job.
 * @param retryAfterMs delay before re-delivery, only set for {@link ErrorCategory#RATE_LIMITED}.
 */
public record CategorizedError(ErrorCategory category, String message, Long retryAfterMs) {

    public static CategorizedError of(ErrorCategory category, String message) {
        return new CategorizedError(category, message, null);
    }

    public boolean isRetryable() {
        return category != ErrorCategory.PERMANENT;
    }
}
