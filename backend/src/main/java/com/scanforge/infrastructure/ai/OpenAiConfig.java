package com.scanforge.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class OpenAiConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.base-url}")
    private String baseUrl;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.fallback-model}")
    private String fallbackModel;

    @Value("${openai.timeout-seconds:60}")
    private long timeoutSeconds;

    @Value("${openai.fallback-timeout-seconds:60}")
    private long fallbackTimeoutSeconds;

    @Value("${openai.max-retries:1}")
    private int maxRetries;

    @Bean
    public ExtractionBackends extractionBackends() {
        LlmBackend primary = new LlmBackend("primary", client(timeoutSeconds), model);
        if (fallbackModel == null || fallbackModel.isBlank()) {
            return new ExtractionBackends(primary, null);
        }
        LlmBackend fallback = new LlmBackend("fallback", client(fallbackTimeoutSeconds), fallbackModel);
        return new ExtractionBackends(primary, fallback);
    }

    private OpenAIClient client(long timeout) {
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .timeout(Duration.ofSeconds(timeout))
                .maxRetries(maxRetries)
                .build();
    }
}
