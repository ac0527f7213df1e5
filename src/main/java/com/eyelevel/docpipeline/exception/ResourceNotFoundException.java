package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a referenced document or processing job does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2178452207623127710L;

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
