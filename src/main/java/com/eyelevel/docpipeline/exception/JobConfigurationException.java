package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown for unknown job types, queue names or unregistered processors.
 */
public class JobConfigurationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3990621760452115246L;

    public JobConfigurationException(String message) {
        super(message);
    }
}
