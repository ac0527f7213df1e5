package com.eyelevel.docpipeline.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope of every REST response, successful or not.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * Whether the client should show {@link #displayMessage}.
     */
    private final Boolean showMessage;

    private final Integer statusCode;

    public static <T> ApiResponse<T> success(String displayMessage, T response, int statusCode) {
        return ApiResponse.<T>builder()
                .displayMessage(displayMessage)
                .response(response)
                .showMessage(displayMessage != null)
                .statusCode(statusCode)
                .build();
    }

    public static <T> ApiResponse<T> error(String displayMessage, int statusCode) {
        return ApiResponse.<T>builder()
                .displayMessage(displayMessage)
                .showMessage(true)
                .statusCode(statusCode)
                .build();
    }
}
