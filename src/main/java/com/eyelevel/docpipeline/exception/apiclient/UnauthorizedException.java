package com.eyelevel.docpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating missing or rejected credentials (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3425009215489604283L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
