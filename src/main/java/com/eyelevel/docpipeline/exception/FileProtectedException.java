package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a document is password-protected or encrypted and cannot be processed.
 */
public class FileProtectedException extends ProcessingException {
    @Serial
    private static final long serialVersionUID = 2983374460871226081L;

    public FileProtectedException(String message) {
        super(message);
    }
}
