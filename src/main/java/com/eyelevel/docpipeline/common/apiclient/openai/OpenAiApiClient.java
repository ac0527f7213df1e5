package com.eyelevel.docpipeline.common.apiclient.openai;

import com.eyelevel.docpipeline.common.apiclient.ApiClient;
import com.eyelevel.docpipeline.common.apiclient.authentication.Authentication;
import com.eyelevel.docpipeline.common.apiclient.model.ApiRequest;
import com.eyelevel.docpipeline.common.apiclient.model.ApiResponse;
import com.eyelevel.docpipeline.common.apiclient.model.HeaderConfig;
import com.eyelevel.docpipeline.common.apiclient.openai.model.*;
import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Client for the OpenAI embeddings and chat completions endpoints.
 */
@Slf4j
@Service
public class OpenAiApiClient extends ApiClient {

    private static final String SERVICE_NAME = "OpenAI";

    private final JsonParser jsonParser;

    public OpenAiApiClient(@Qualifier("openAiWebClient") WebClient webClient,
                           @Qualifier("openAiAuthentication") Authentication authentication,
                           @Qualifier("openAiHeaderConfig") HeaderConfig headerConfig,
                           @Qualifier("jacksonJsonParser") JsonParser jsonParser,
                           @Value("${app.openai.timeout-seconds:60}") long timeoutSeconds) {
        super(webClient, authentication, headerConfig, SERVICE_NAME, Duration.ofSeconds(timeoutSeconds));
        this.jsonParser = jsonParser;
    }

    /**
     * @return false when no API key is configured; callers skip their AI step in that case.
     */
    public boolean isConfigured() {
        return authentication.isConfigured();
    }

    /**
     * Embeds a batch of inputs in one call.
     */
    public EmbeddingResponse createEmbeddings(String model, List<String> inputs, Integer dimensions) {
        log.debug("Requesting {} embedding(s) with model {}", inputs.size(), model);
        EmbeddingRequest request = EmbeddingRequest.builder().model(model).input(inputs).dimensions(dimensions).build();
        return post("/embeddings", request, EmbeddingResponse.class);
    }

    /**
     * Sends a single user prompt and returns the content of the first choice.
     */
    public String complete(String model, String prompt, double temperature, int maxTokens) {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(ChatMessage.user(prompt)))
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        ChatCompletionResponse response = post("/chat/completions", request, ChatCompletionResponse.class);
        if (response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null) {
            throw new ApiException(SERVICE_NAME + " API error: 200 - response contained no choices", 502);
        }
        return response.getChoices().get(0).getMessage().getContent();
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        ApiRequest apiRequest = ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(path)
                .body(body)
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
        ApiResponse apiResponse = call(apiRequest);
        return jsonParser.parseObject(apiResponse.getData(), responseType);
    }
}
