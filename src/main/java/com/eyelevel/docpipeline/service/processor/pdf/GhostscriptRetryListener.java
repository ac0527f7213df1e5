package com.eyelevel.docpipeline.service.processor.pdf;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs each failed Ghostscript attempt of a PDF compress job and the final give-up.
 */
@Slf4j
@Component(GhostscriptRetryListener.BEAN_NAME)
public class GhostscriptRetryListener implements RetryListener {

    static final String BEAN_NAME = "ghostscriptRetryListener";

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Ghostscript attempt {} failed: {}", context.getRetryCount(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null) {
            log.error("Ghostscript compression gave up after {} attempt(s)", context.getRetryCount(), throwable);
        }
    }
}
