package com.eyelevel.docpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating a malformed or rejected request (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6051213542139185441L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
