package com.lemur.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lemur.backend.BaseE2ETest;
import com.lemur.backend.dto.StartAgentRequest;
import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.SessionStatus;
import com.lemur.backend.service.AgentSessionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AgentControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AgentSessionService sessionService;

    @Test
    void shouldAccessHealthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void shouldStartSession() throws Exception {
        // Given
        StartAgentRequest request = StartAgentRequest.builder()
                .html("<html><head><style>h1{}</style></head><body><h1>Hi</h1></body></html>")
                .query("Make the heading red")
                .modelType("gemini")
                .build();

        // When
        MvcResult result = mockMvc.perform(post("/agent/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").exists())
                .andReturn();

        // Then
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        AgentSession session = sessionService.require(body.path("session_id").asText());
        assertEquals(SessionStatus.CREATED, session.getStatus());
        assertEquals("gemini", session.getBackend());
        assertEquals("<html><head>__st1__</head><body><h1>Hi</h1></body></html>", session.getShieldedDocument());
    }

    @Test
    void shouldRejectBlankDocument() throws Exception {
        mockMvc.perform(post("/agent/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"html\": \"\", \"query\": \"anything\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRejectUnknownBackend() throws Exception {
        mockMvc.perform(post("/agent/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"html\": \"<p>x</p>\", \"query\": \"anything\", \"model_type\": \"nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("nope")));
    }

    @Test
    void shouldGetSession() throws Exception {
        AgentSession session = sessionService.createSession("<p>x</p>", "Bold it", null, null);

        mockMvc.perform(get("/agent/" + session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CREATED"))
                .andExpect(jsonPath("$.currentIteration").value(0))
                .andExpect(jsonPath("$.maxIterations").value(10))
                .andExpect(jsonPath("$.currentDocument").value("<p>x</p>"));
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() throws Exception {
        mockMvc.perform(get("/agent/does-not-exist"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldListNoSnapshotsForFreshSession() throws Exception {
        AgentSession session = sessionService.createSession("<p>x</p>", "Bold it", null, null);

        mockMvc.perform(get("/agent/" + session.getId() + "/snapshots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}
