package com.eyelevel.docpipeline.common.apiclient.authentication;

import java.util.Map;

/**
 * Adds credentials to an outbound request's headers.
 */
public interface Authentication {

    void applyAuthentication(Map<String, String> headers);

    /**
     * @return false when no credentials are configured and calls should be skipped.
     */
    boolean isConfigured();
}
