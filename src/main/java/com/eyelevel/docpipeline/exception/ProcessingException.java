package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * A base exception for errors raised while executing a processing job.
 */
public class ProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
