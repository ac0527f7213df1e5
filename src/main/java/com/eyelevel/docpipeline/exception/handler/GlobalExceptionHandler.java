package com.eyelevel.docpipeline.exception.handler;

import com.eyelevel.docpipeline.dto.common.ApiResponse;
import com.eyelevel.docpipeline.exception.JobConfigurationException;
import com.eyelevel.docpipeline.exception.JobStateException;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.exception.ResourceNotFoundException;
import com.eyelevel.docpipeline.exception.apiclient.ApiException;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.util.stream.Collectors;

/**
 * Converts exceptions thrown from controllers into the {@link ApiResponse} envelope with the matching HTTP status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Unknown job types and invalid operation arguments. (400 Bad Request)
     */
    @ExceptionHandler({JobConfigurationException.class, JsonParsingException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return respond(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond("Malformed request body. The request body is missing or could not be parsed.",
                       HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(
            MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(),
                                            ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return respond(errorMessage, HttpStatus.BAD_REQUEST);
    }

    /**
     * {@code @Valid} request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(errorMessage, HttpStatus.BAD_REQUEST);
    }

    /**
     * {@code @Validated} path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1),
                                         violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return respond(errorMessage, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.",
                                            ex.getValue(), ex.getName(), ex.getRequiredType() != null
                                                    ? ex.getRequiredType().getSimpleName()
                                                    : "unknown");
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return respond(errorMessage, HttpStatus.BAD_REQUEST);
    }

    /**
     * Missing documents, jobs and queues. (404 Not Found)
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return respond(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    /**
     * Requires 'spring.mvc.throw-exception-if-no-handler-found=true'. (404 Not Found)
     */
    @ExceptionHandler(NoHandlerFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNoHandlerFound(NoHandlerFoundException ex) {
        String errorMessage = String.format("No endpoint %s found for %s", ex.getHttpMethod(), ex.getRequestURL());
        log.warn("Handling NoHandlerFoundException: {}", errorMessage);
        return respond(errorMessage, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = ex.getSupportedMethods() != null
                ? String.join(", ", ex.getSupportedMethods())
                : "none";
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                            ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(errorMessage, HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * A retry or cancel the job's current status does not allow. (409 Conflict)
     */
    @ExceptionHandler(JobStateException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(JobStateException ex) {
        log.warn("Job State Exception: {}", ex.getMessage());
        return respond(ex.getMessage(), HttpStatus.CONFLICT);
    }

    // --- Upstream and 5xx Server Error Handlers ---

    /**
     * Errors from an outbound API call, reported with the status the upstream returned.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Object>> handleApiException(ApiException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode());
        if (status == null) {
            status = HttpStatus.BAD_GATEWAY;
        }
        if (status.is5xxServerError()) {
            log.error("Upstream API Exception: {}", ex.getMessage());
        } else {
            log.warn("Upstream API Exception: {}", ex.getMessage());
        }
        return respond(ex.getMessage(), status);
    }

    @ExceptionHandler(ProcessingException.class)
    public ResponseEntity<ApiResponse<Object>> handleProcessingException(ProcessingException ex) {
        log.error("Processing Exception: {}", ex.getMessage(), ex);
        return respond(ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return respond("An unexpected internal error occurred. Please contact support.",
                       HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ApiResponse<Object>> respond(String message, HttpStatus status) {
        return new ResponseEntity<>(ApiResponse.error(message, status.value()), status);
    }
}
