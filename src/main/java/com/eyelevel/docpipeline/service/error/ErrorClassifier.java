package com.eyelevel.docpipeline.service.error;

import com.eyelevel.docpipeline.exception.apiclient.TooManyRequestsException;
import com.eyelevel.docpipeline.model.CategorizedError;
import com.eyelevel.docpipeline.model.ErrorCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a raw failure to an {@link ErrorCategory} by keyword matching on the lower-cased message.
 * <p>
 * Rules are evaluated in a fixed order and the first match wins:
 * <ol>
 *     <li>rate limiting and throttling: {@link ErrorCategory#RATE_LIMITED}</li>
 *     <li>access and credential failures: {@link ErrorCategory#PERMANENT}</li>
 *     <li>missing resources: {@link ErrorCategory#PERMANENT}</li>
 *     <li>network and timeout failures: {@link ErrorCategory#TRANSIENT}</li>
 *     <li>invalid input: {@link ErrorCategory#PERMANENT}</li>
 *     <li>anything else: {@link ErrorCategory#UNKNOWN}</li>
 * </ol>
 * A message such as "invalid response: timeout" is therefore TRANSIENT, because the network rule is checked first.
 */
@Component
public class ErrorClassifier {

    public static final long DEFAULT_RETRY_AFTER_MS = 60_000L;

    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d+)", Pattern.CASE_INSENSITIVE);

    private static final List<String> RATE_LIMIT_KEYWORDS = List.of("rate exceeded", "throttl", "rate limit", "429");
    private static final List<String> ACCESS_KEYWORDS = List.of("access denied", "forbidden");
    private static final List<String> CREDENTIAL_KEYWORDS = List.of("invalid api key", "authentication");
    private static final List<String> NOT_FOUND_KEYWORDS = List.of("not found", "does not exist");
    private static final List<String> NETWORK_KEYWORDS = List.of("timeout", "econnrefused", "econnreset",
            "connection refused", "connection reset", "network");
    private static final List<String> INVALID_INPUT_KEYWORDS = List.of("invalid", "unsupported", "corrupt");

    /**
     * Classifies a thrown error, reading a structured retry-after hint when the error carries one.
     */
    public CategorizedError classify(Throwable error) {
        Long retryAfterSeconds = null;
        if (error instanceof TooManyRequestsException tooManyRequests) {
            retryAfterSeconds = tooManyRequests.getRetryAfterSeconds();
        }
        return classify(messageOf(error), retryAfterSeconds);
    }

    /**
     * Classifies a raw error message.
     *
     * @param rawMessage        the failure message, may be null.
     * @param retryAfterSeconds an explicit retry-after value in seconds, may be null.
     */
    public CategorizedError classify(String rawMessage, Long retryAfterSeconds) {
        String message = (rawMessage == null || rawMessage.isBlank()) ? "Unknown error" : rawMessage;
        String lower = message.toLowerCase(Locale.ROOT);

        if (containsAny(lower, RATE_LIMIT_KEYWORDS)) {
            return new CategorizedError(ErrorCategory.RATE_LIMITED, message, resolveRetryAfterMs(message, retryAfterSeconds));
        }
        if (containsAny(lower, ACCESS_KEYWORDS)) {
            return CategorizedError.of(ErrorCategory.PERMANENT, "Access denied - check permissions");
        }
        if (containsAny(lower, CREDENTIAL_KEYWORDS)) {
            return CategorizedError.of(ErrorCategory.PERMANENT, "Invalid API credentials");
        }
        if (containsAny(lower, NOT_FOUND_KEYWORDS)) {
            return CategorizedError.of(ErrorCategory.PERMANENT, "Resource not found");
        }
        if (containsAny(lower, NETWORK_KEYWORDS)) {
            return CategorizedError.of(ErrorCategory.TRANSIENT, message);
        }
        if (containsAny(lower, INVALID_INPUT_KEYWORDS)) {
            return CategorizedError.of(ErrorCategory.PERMANENT, message);
        }
        return CategorizedError.of(ErrorCategory.UNKNOWN, message);
    }

    private long resolveRetryAfterMs(String message, Long retryAfterSeconds) {
        if (retryAfterSeconds != null && retryAfterSeconds > 0) {
            return retryAfterSeconds * 1000L;
        }
        Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
        if (matcher.find()) {
            long seconds = Long.parseLong(matcher.group(1));
            if (seconds > 0) {
                return seconds * 1000L;
            }
        }
        return DEFAULT_RETRY_AFTER_MS;
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return null;
        }
        if (error.getMessage() != null) {
            return error.getMessage();
        }
        return error.getCause() != null ? error.getCause().getMessage() : error.getClass().getSimpleName();
    }

    private static boolean containsAny(String haystack, List<String> keywords) {
        for (String keyword : keywords) {
            if (haystack.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
