package com.eyelevel.docpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating the requested resource was not found (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8612094571349822735L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
