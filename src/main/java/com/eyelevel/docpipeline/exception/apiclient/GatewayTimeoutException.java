package com.eyelevel.docpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating the call did not complete in time (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5902811426073612690L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
