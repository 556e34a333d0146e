package com.lemur.backend.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lemur.backend.model.AgentSession;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store for unit tests. Records are kept as JSON so every read returns a fresh copy,
 * as with the Redis store.
 */
public class InMemorySessionStore implements SessionStore {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Map<String, String> records = new ConcurrentHashMap<>();

    @Override
    public Optional<AgentSession> get(String sessionId) {
        String json = records.get(sessionId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, AgentSession.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public boolean set(String sessionId, AgentSession session) {
        try {
            records.put(sessionId, objectMapper.writeValueAsString(session));
            return true;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public void remove(String sessionId) {
        records.remove(sessionId);
    }
}
