package com.lemur.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MorphPatchClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private MorphPatchClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        doReturn(response).when(httpClient).send(any(), any());
        client = new MorphPatchClient(httpClient, objectMapper, "https://morph.test/v1/chat/completions", "m-key",
                "morph-v3-fast", Duration.ofSeconds(5));
    }

    @Test
    void shouldWrapDocumentAndUpdate() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"choices\":[{\"message\":{\"content\":\"<p>new</p>\"}}]}");

        String patched = client.apply("<p>old</p>", "<p>new</p>");

        assertEquals("<p>new</p>", patched);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        JsonNode body = objectMapper.readTree(OpenRouterCompletionBackendTest.bodyOf(request.getValue()));
        assertEquals("morph-v3-fast", body.path("model").asText());
        assertEquals("<code><p>old</p></code>\n<update><p>new</p></update>",
                body.path("messages").path(0).path("content").asText());
    }

    @Test
    void shouldFailWithoutChoices() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"id\":\"x\"}");

        PatchException error = assertThrows(PatchException.class, () -> client.apply("<p>a</p>", "<p>b</p>"));
        assertEquals("Invalid Morph API response: no choices", error.getMessage());
    }

    @Test
    void shouldFailOnBlankDocument() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"choices\":[{\"message\":{\"content\":\"  \"}}]}");

        assertThrows(PatchException.class, () -> client.apply("<p>a</p>", "<p>b</p>"));
    }

    @Test
    void shouldWrapTransportFailure() throws Exception {
        doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

        PatchException error = assertThrows(PatchException.class, () -> client.apply("<p>a</p>", "<p>b</p>"));
        assertEquals("Morph API error: connection refused", error.getMessage());
    }
}
