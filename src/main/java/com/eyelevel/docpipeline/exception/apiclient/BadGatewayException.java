package com.eyelevel.docpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating an invalid response from an upstream server (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2390047851823007733L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
