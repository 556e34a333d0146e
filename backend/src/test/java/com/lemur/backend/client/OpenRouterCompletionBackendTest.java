package com.lemur.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OpenRouterCompletionBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpClient httpClient;
    private HttpResponse<String> response;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        doReturn(response).when(httpClient).send(any(), any());
    }

    private OpenRouterCompletionBackend backend(String apiKey) {
        return new OpenRouterCompletionBackend(httpClient, objectMapper, "https://openrouter.test/v1/chat/completions",
                apiKey, "test-model", 1000, Duration.ofSeconds(5));
    }

    @Test
    void shouldReturnMessageContent() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"choices\":[{\"message\":{\"content\":\"{\\\"edits\\\":\\\"x\\\"}\"}}]}");

        String text = backend("key-1").complete(CompletionRequest.textOnly("prompt"));

        assertEquals("{\"edits\":\"x\"}", text);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals("Bearer key-1", request.getValue().headers().firstValue("Authorization").orElseThrow());
        assertEquals("https://openrouter.test/v1/chat/completions", request.getValue().uri().toString());

        JsonNode body = objectMapper.readTree(bodyOf(request.getValue()));
        assertEquals("test-model", body.path("model").asText());
        assertEquals(1000, body.path("max_tokens").asInt());
        assertEquals("prompt", body.path("messages").path(0).path("content").asText());
    }

    @Test
    void shouldSendImageAsContentPart() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");

        backend("key-1").complete(new CompletionRequest("look", "aGk="));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        JsonNode content = objectMapper.readTree(bodyOf(request.getValue()))
                .path("messages").path(0).path("content");
        assertTrue(content.isArray());
        assertEquals("look", content.path(0).path("text").asText());
        assertEquals("data:image/png;base64,aGk=", content.path(1).path("image_url").path("url").asText());
    }

    @Test
    void shouldFailOnHttpError() {
        when(response.statusCode()).thenReturn(429);
        when(response.body()).thenReturn("rate limited");

        CompletionException error = assertThrows(CompletionException.class,
                () -> backend("key-1").complete(CompletionRequest.textOnly("prompt")));
        assertTrue(error.getMessage().contains("HTTP 429"));
    }

    @Test
    void shouldFailOnEmptyContent() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"choices\":[]}");

        assertThrows(CompletionException.class, () -> backend("key-1").complete(CompletionRequest.textOnly("p")));
    }

    @Test
    void shouldFailWithoutApiKey() throws Exception {
        assertThrows(CompletionException.class, () -> backend("").complete(CompletionRequest.textOnly("p")));
        verify(httpClient, never()).send(any(), any());
    }

    /**
     * Drain a request body publisher into a string.
     */
    static String bodyOf(HttpRequest request) throws Exception {
        CompletableFuture<String> result = new CompletableFuture<>();
        StringBuilder out = new StringBuilder();
        request.bodyPublisher().orElseThrow().subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                byte[] bytes = new byte[item.remaining()];
                item.get(bytes);
                out.append(new String(bytes, StandardCharsets.UTF_8));
            }

            @Override
            public void onError(Throwable throwable) {
                result.completeExceptionally(throwable);
            }

            @Override
            public void onComplete() {
                result.complete(out.toString());
            }
        });
        return result.get();
    }
}
