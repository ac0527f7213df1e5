package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when an operation is refused because of the job's current state,
 * e.g. retrying a job that has not failed or cancelling a job that already started.
 */
public class JobStateException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7705138127004263384L;

    public JobStateException(String message) {
        super(message);
    }
}
