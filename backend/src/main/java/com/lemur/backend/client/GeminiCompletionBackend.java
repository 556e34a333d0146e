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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code generateContent}. Screenshots travel as {@code inline_data} parts.
 */
@Component
public class GeminiCompletionBackend extends AbstractJsonHttpClient implements CompletionBackend {

    private static final Logger log = LoggerFactory.getLogger(GeminiCompletionBackend.class);

    public static final String NAME = "gemini";

    private final String apiUrl;
    private final String apiKey;

    @Autowired
    public GeminiCompletionBackend(ObjectMapper objectMapper,
            @Value("${gemini.api.url:https://generativelanguage.googleapis.com/v1beta/models/gemini-2.0-flash:generateContent}") String apiUrl,
            @Value("${gemini.api.key:}") String apiKey,
            @Value("${agent.http.request-timeout:120s}") Duration requestTimeout) {
        this(defaultHttpClient(), objectMapper, apiUrl, apiKey, requestTimeout);
    }

    GeminiCompletionBackend(HttpClient httpClient, ObjectMapper objectMapper, String apiUrl, String apiKey,
            Duration requestTimeout) {
        super(httpClient, objectMapper, requestTimeout);
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String complete(CompletionRequest request) throws InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new CompletionException("Gemini API key is not configured");
        }

        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("text", request.prompt()));
        if (request.hasImage()) {
            parts.add(Map.of("inline_data", Map.of("mime_type", "image/png", "data", request.imageBase64())));
        }
        Map<String, Object> body = Map.of("contents", List.of(Map.of("parts", parts)));

        log.info("[ORACLE] Gemini request | prompt length: {} | image: {}",
                request.prompt().length(), request.hasImage());

        JsonNode response;
        try {
            response = postJson(apiUrl, body, Map.of("X-goog-api-key", apiKey));
        } catch (IOException e) {
            log.error("[ORACLE] Gemini call failed: {}", e.getMessage());
            throw new CompletionException("Gemini API error: " + e.getMessage(), e);
        }

        JsonNode candidate = response.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            log.error("[ORACLE] Gemini returned no candidates: {}", response);
            throw new CompletionException("No candidates in Gemini response");
        }
        String text = candidate.path("content").path("parts").path(0).path("text").asText("");
        if (text.isBlank()) {
            log.error("[ORACLE] Gemini candidate has no text: {}", candidate);
            throw new CompletionException("No text in Gemini response");
        }
        log.info("[ORACLE] Gemini response length: {}", text.length());
        return text;
    }
}
