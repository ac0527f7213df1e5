package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Signals the queue that the job failed permanently and no further attempt may run.
 */
public class UnrecoverableJobException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1254420957105380532L;

    public UnrecoverableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
