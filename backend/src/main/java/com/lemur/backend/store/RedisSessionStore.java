package com.lemur.backend.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lemur.backend.model.AgentSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Stores each session as a JSON string under its own Redis key.
 */
@Component
public class RedisSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    static final String KEY_PREFIX = "lemur:session:";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisSessionStore(StringRedisTemplate redis,
            ObjectMapper objectMapper,
            @Value("${agent.session.ttl:24h}") Duration ttl) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public Optional<AgentSession> get(String sessionId) {
        String json = redis.opsForValue().get(KEY_PREFIX + sessionId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, AgentSession.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt session record: " + sessionId, e);
        }
    }

    @Override
    public boolean set(String sessionId, AgentSession session) {
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            log.error("[STORE] Failed to serialize session: {}", sessionId, e);
            return false;
        }

        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(KEY_PREFIX + sessionId, json);
        } else {
            redis.opsForValue().set(KEY_PREFIX + sessionId, json, ttl);
        }
        return true;
    }
}
