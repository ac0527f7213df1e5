package com.eyelevel.docpipeline.common.apiclient;

import com.eyelevel.docpipeline.common.apiclient.authentication.Authentication;
import com.eyelevel.docpipeline.common.apiclient.model.ApiRequest;
import com.eyelevel.docpipeline.common.apiclient.model.ApiResponse;
import com.eyelevel.docpipeline.common.apiclient.model.HeaderConfig;
import com.eyelevel.docpipeline.exception.apiclient.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for blocking API clients built on {@link WebClient}.
 * <p>
 * Non-2xx responses are mapped to the {@link ApiException} hierarchy with the message
 * {@code "<service> API error: <status> - <body>"}. Connection failures become
 * {@link ServiceUnavailableException} and timeouts {@link GatewayTimeoutException}.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;
    private final String serviceName;
    private final Duration timeout;

    protected ApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig,
                        String serviceName, Duration timeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.headerConfig = headerConfig;
        this.serviceName = serviceName;
        this.timeout = timeout;
    }

    /**
     * Executes the request and blocks for the response.
     *
     * @throws ApiException for any non-2xx response or transport failure.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling {} API with method: {} and path: {}", serviceName, apiRequest.getMethod(),
                  apiRequest.getPath());
        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);
            return requestBodySpec.exchangeToMono(this::handleResponse)
                                  .timeout(timeout)
                                  .onErrorMap(error -> !(error instanceof ApiException), this::mapException)
                                  .block();
        } catch (ApiException e) {
            log.warn("{} API call to {} failed: {}", serviceName, apiRequest.getPath(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected failure calling {} API at {}", serviceName, apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException responseError) {
            return createException(responseError.getResponseBodyAsString(), responseError.getStatusCode().value(),
                                   responseError.getHeaders());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException
                || error instanceof UnknownHostException) {
            return new ServiceUnavailableException(
                    serviceName + " API network error: failed to connect: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException(serviceName + " API timeout after " + timeout.toMillis() + "ms");
        }
        return new ApiException(serviceName + " API error: " + error.getMessage(), 500);
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());
        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }
        Optional.ofNullable(apiRequest.getHeaders()).ifPresent(headers -> headers.forEach(requestBodySpec::header));
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        requestBodySpec.contentType(Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON));
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            throw new BadRequestException(serviceName + " API error: invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        HttpHeaders headers = response.headers().asHttpHeaders();
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder().data(data).acceptType(headers.getContentType())
                                                   .headers(headers).statusCode(statusCode)
                                                   .timestamp(Instant.now()).build());
        }
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode, headers)));
    }

    private ApiException createException(String body, int statusCode, HttpHeaders headers) {
        String message = serviceName + " API error: " + statusCode + " - " + body;
        return switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 401 -> new UnauthorizedException(message);
            case 403 -> new ForbiddenException(message);
            case 404 -> new NotFoundException(message);
            case 429 -> new TooManyRequestsException(message, parseRetryAfter(headers));
            case 502 -> new BadGatewayException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
    }

    private static Long parseRetryAfter(HttpHeaders headers) {
        String retryAfter = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (retryAfter == null) {
            return null;
        }
        try {
            return (long) Math.ceil(Double.parseDouble(retryAfter.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", retryAfter);
            return null;
        }
    }
}
