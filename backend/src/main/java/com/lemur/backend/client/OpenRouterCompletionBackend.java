package com.lemur.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions through OpenRouter. Screenshots are sent as an
 * {@code image_url} content part next to the prompt text.
 */
@Component
public class OpenRouterCompletionBackend extends AbstractJsonHttpClient implements CompletionBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterCompletionBackend.class);

    public static final String NAME = "openrouter";

    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    @Autowired
    public OpenRouterCompletionBackend(ObjectMapper objectMapper,
            @Value("${openrouter.api.url:https://openrouter.ai/api/v1/chat/completions}") String apiUrl,
            @Value("${openrouter.api.key:}") String apiKey,
            @Value("${openrouter.api.model:meta-llama/llama-4-maverick}") String model,
            @Value("${openrouter.api.max-tokens:4000}") int maxTokens,
            @Value("${agent.http.request-timeout:120s}") Duration requestTimeout) {
        this(defaultHttpClient(), objectMapper, apiUrl, apiKey, model, maxTokens, requestTimeout);
    }

    OpenRouterCompletionBackend(HttpClient httpClient, ObjectMapper objectMapper, String apiUrl, String apiKey,
            String model, int maxTokens, Duration requestTimeout) {
        super(httpClient, objectMapper, requestTimeout);
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String complete(CompletionRequest request) throws InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new CompletionException("OpenRouter API key is not configured");
        }

        Object content = request.prompt();
        if (request.hasImage()) {
            content = List.of(
                    Map.of("type", "text", "text", request.prompt()),
                    Map.of("type", "image_url",
                            "image_url", Map.of("url", "data:image/png;base64," + request.imageBase64())));
        }

        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "messages", List.of(Map.of("role", "user", "content", content)));

        log.info("[ORACLE] OpenRouter request | model: {} | prompt length: {} | image: {}",
                model, request.prompt().length(), request.hasImage());

        JsonNode response;
        try {
            response = postJson(apiUrl, body, Map.of("Authorization", "Bearer " + apiKey));
        } catch (IOException e) {
            log.error("[ORACLE] OpenRouter call failed: {}", e.getMessage());
            throw new CompletionException("OpenRouter API error: " + e.getMessage(), e);
        }

        String text = response.path("choices").path(0).path("message").path("content").asText("");
        if (text.isBlank()) {
            log.error("[ORACLE] OpenRouter returned no content: {}", response);
            throw new CompletionException("No response content from OpenRouter");
        }
        log.info("[ORACLE] OpenRouter response length: {}", text.length());
        return text;
    }
}
