package com.eyelevel.docpipeline.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.util.HashMap;
import java.util.Map;

/**
 * An outbound HTTP request issued through {@link com.eyelevel.docpipeline.common.apiclient.ApiClient}.
 */
@Data
@Builder
public class ApiRequest {
    private HttpMethod method;
    private String path;
    private Map<String, Object> queryParams;
    private Map<String, Object> pathVariables;
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();
    private Object body;
    private MediaType acceptMediaType;
    private MediaType contentType;
}
