package com.eyelevel.docpipeline.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.time.Instant;

/**
 * Raw response of a successful outbound call.
 */
@Data
@Builder
public class ApiResponse {
    private byte[] data;
    private MediaType acceptType;
    private HttpHeaders headers;
    private int statusCode;
    private Instant timestamp;
}
