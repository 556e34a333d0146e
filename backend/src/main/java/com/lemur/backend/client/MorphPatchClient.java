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
 * Patch collaborator backed by Morph's fast-apply chat endpoint.
 */
@Component
public class MorphPatchClient extends AbstractJsonHttpClient implements PatchCollaborator {

    private static final Logger log = LoggerFactory.getLogger(MorphPatchClient.class);

    private final String apiUrl;
    private final String apiKey;
    private final String model;

    @Autowired
    public MorphPatchClient(ObjectMapper objectMapper,
            @Value("${morph.api.url:https://api.morphllm.com/v1/chat/completions}") String apiUrl,
            @Value("${morph.api.key:}") String apiKey,
            @Value("${morph.api.model:morph-v3-fast}") String model,
            @Value("${agent.http.request-timeout:120s}") Duration requestTimeout) {
        this(defaultHttpClient(), objectMapper, apiUrl, apiKey, model, requestTimeout);
    }

    MorphPatchClient(HttpClient httpClient, ObjectMapper objectMapper, String apiUrl, String apiKey, String model,
            Duration requestTimeout) {
        super(httpClient, objectMapper, requestTimeout);
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public String apply(String document, String editInstructions) throws InterruptedException {
        String content = "<code>" + document + "</code>\n<update>" + editInstructions + "</update>";
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", content)));

        log.info("[PATCH] Morph request | document length: {} | update length: {}",
                document.length(), editInstructions.length());

        JsonNode response;
        try {
            response = postJson(apiUrl, body, Map.of("Authorization", "Bearer " + apiKey));
        } catch (IOException e) {
            log.error("[PATCH] Morph call failed: {}", e.getMessage());
            throw new PatchException("Morph API error: " + e.getMessage(), e);
        }

        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            log.error("[PATCH] Invalid Morph response: {}", response);
            throw new PatchException("Invalid Morph API response: no choices");
        }
        String patched = choices.path(0).path("message").path("content").asText("");
        if (patched.isBlank()) {
            throw new PatchException("Morph API returned an empty document");
        }
        log.info("[PATCH] Morph response length: {}", patched.length());
        return patched;
    }
}
