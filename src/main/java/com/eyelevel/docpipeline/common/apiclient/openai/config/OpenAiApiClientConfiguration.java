package com.eyelevel.docpipeline.common.apiclient.openai.config;

import com.eyelevel.docpipeline.common.apiclient.authentication.Authentication;
import com.eyelevel.docpipeline.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.docpipeline.common.apiclient.model.HeaderConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Beans for {@link com.eyelevel.docpipeline.common.apiclient.openai.OpenAiApiClient}.
 */
@Slf4j
@Configuration
public class OpenAiApiClientConfiguration {

    /**
     * Embedding batches of 2048 inputs produce large responses.
     */
    private static final int MAX_IN_MEMORY_SIZE = 64 * 1024 * 1024;

    @Value("${app.openai.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${app.openai.api-key:}")
    private String apiKey;

    @Value("${app.openai.organization:}")
    private String organization;

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(WebClient.Builder builder) {
        if (!StringUtils.hasText(apiKey)) {
            log.warn("app.openai.api-key is not set. Embedding and AI classification jobs will be skipped.");
        }
        return builder.baseUrl(baseUrl)
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build())
                .build();
    }

    @Bean("openAiAuthentication")
    public Authentication openAiAuthentication() {
        return new BearerTokenAuthentication(apiKey);
    }

    @Bean("openAiHeaderConfig")
    public HeaderConfig openAiHeaderConfig() {
        if (StringUtils.hasText(organization)) {
            return new HeaderConfig(List.of(new HeaderConfig.Header("OpenAI-Organization", organization)));
        }
        return new HeaderConfig(List.of());
    }
}
