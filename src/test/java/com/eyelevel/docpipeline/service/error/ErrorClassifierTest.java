package com.eyelevel.docpipeline.service.error;

import com.eyelevel.docpipeline.exception.apiclient.TooManyRequestsException;
import com.eyelevel.docpipeline.model.CategorizedError;
import com.eyelevel.docpipeline.model.ErrorCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"Rate exceeded", "ProvisionedThroughputExceededException: Throttling",
            "Request was THROTTLED by the service", "OpenAI API error: 429 - slow down", "rate limit reached"})
    void rateLimitMessagesAreRateLimitedWithPositiveDelay(String message) {
        CategorizedError result = classifier.classify(message, null);

        assertEquals(ErrorCategory.RATE_LIMITED, result.category());
        assertThat(result.retryAfterMs()).isNotNull().isGreaterThanOrEqualTo(1L);
        assertEquals(message, result.message());
    }

    @Test
    void rateLimitUsesDefaultDelayWithoutHint() {
        assertEquals(ErrorClassifier.DEFAULT_RETRY_AFTER_MS,
                     classifier.classify("Rate exceeded", null).retryAfterMs());
    }

    @Test
    void rateLimitReadsRetryAfterFromMessage() {
        assertEquals(30_000L, classifier.classify("Throttled, retry after 30 seconds", null).retryAfterMs());
    }

    @Test
    void rateLimitPrefersExplicitRetryAfterHeader() {
        TooManyRequestsException error = new TooManyRequestsException("OpenAI API error: 429 - quota", 12L);

        CategorizedError result = classifier.classify(error);

        assertEquals(ErrorCategory.RATE_LIMITED, result.category());
        assertEquals(12_000L, result.retryAfterMs());
    }

    @ParameterizedTest
    @CsvSource({
            "'AccessDeniedException: Access Denied', 'Access denied - check permissions'",
            "'403 Forbidden', 'Access denied - check permissions'",
            "'Invalid API key provided', 'Invalid API credentials'",
            "'Authentication failed', 'Invalid API credentials'",
            "'NoSuchKey: The specified key does not exist', 'Resource not found'",
            "'Document not found: 42', 'Resource not found'"
    })
    void accessAndMissingResourceFailuresArePermanentWithFixedMessage(String message, String expected) {
        CategorizedError result = classifier.classify(message, null);

        assertEquals(ErrorCategory.PERMANENT, result.category());
        assertEquals(expected, result.message());
        assertNull(result.retryAfterMs());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Invalid or corrupt PDF: header missing", "Unsupported file type for OCR: text/plain",
            "The file is corrupt"})
    void invalidInputIsPermanentAndKeepsMessage(String message) {
        CategorizedError result = classifier.classify(message, null);

        assertEquals(ErrorCategory.PERMANENT, result.category());
        assertEquals(message, result.message());
    }

    @ParameterizedTest
    @ValueSource(strings = {"connect ECONNREFUSED 127.0.0.1:443", "read ECONNRESET", "Network is unreachable",
            "Textract job abc timeout: no result within 300000ms", "Connection reset by peer"})
    void networkFailuresAreTransient(String message) {
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(message, null).category());
    }

    @Test
    void networkRuleWinsOverInvalidInput() {
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify("invalid response: timeout", null).category());
    }

    @Test
    void rateLimitWinsOverEverythingElse() {
        assertEquals(ErrorCategory.RATE_LIMITED,
                     classifier.classify("Rate exceeded: invalid request timeout", null).category());
    }

    @Test
    void unmatchedMessageIsUnknown() {
        CategorizedError result = classifier.classify("Something odd happened", null);

        assertEquals(ErrorCategory.UNKNOWN, result.category());
        assertEquals("Something odd happened", result.message());
    }

    @Test
    void blankMessageBecomesUnknownError() {
        CategorizedError result = classifier.classify(new IllegalStateException(""));

        assertEquals(ErrorCategory.UNKNOWN, result.category());
        assertEquals("Unknown error", result.message());
    }

    @Test
    void messageIsTakenFromCauseWhenMissing() {
        RuntimeException error = new RuntimeException((String) null, new IllegalStateException("Access Denied"));

        assertEquals(ErrorCategory.PERMANENT, classifier.classify(error).category());
    }
}
