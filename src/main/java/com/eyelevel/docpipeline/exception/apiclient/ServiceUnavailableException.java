package com.eyelevel.docpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating the service is unreachable or overloaded (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4427081936263810032L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
