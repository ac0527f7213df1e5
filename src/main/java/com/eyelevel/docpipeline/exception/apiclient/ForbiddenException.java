package com.eyelevel.docpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating the caller may not access the resource (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1289873317003362171L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
