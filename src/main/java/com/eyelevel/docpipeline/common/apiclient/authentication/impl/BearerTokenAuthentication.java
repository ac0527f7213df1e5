package com.eyelevel.docpipeline.common.apiclient.authentication.impl;

import com.eyelevel.docpipeline.common.apiclient.authentication.Authentication;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Sends the API key as an {@code Authorization: Bearer} header.
 */
public record BearerTokenAuthentication(String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (isConfigured()) {
            headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(apiKey);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[apiKey=***]";
    }
}
