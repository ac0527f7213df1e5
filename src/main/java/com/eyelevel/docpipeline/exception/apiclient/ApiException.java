package com.eyelevel.docpipeline.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors returned by an external HTTP API.
 *
 * <p>The message always reads {@code "<service> API error: <status> - <body>"}, which is what failure
 * classification matches on.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
