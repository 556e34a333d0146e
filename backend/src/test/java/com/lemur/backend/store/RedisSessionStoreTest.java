package com.lemur.backend.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.ConversationTurn;
import com.lemur.backend.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisSessionStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private StringRedisTemplate redis;
    private ValueOperations<String, String> values;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        values = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
    }

    @Test
    void shouldWriteJsonUnderPrefixedKeyWithTtl() throws Exception {
        RedisSessionStore store = new RedisSessionStore(redis, objectMapper, Duration.ofHours(24));
        AgentSession session = AgentSession.builder()
                .id("s1")
                .originalRequest("Make it red")
                .placeholders(Map.of("__sc1__", "<script></script>"))
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
        session.getTurns().add(ConversationTurn.agent("Colored", "<p>x</p>"));

        assertTrue(store.set("s1", session));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(values).set(eq("lemur:session:s1"), json.capture(), eq(Duration.ofHours(24)));
        AgentSession stored = objectMapper.readValue(json.getValue(), AgentSession.class);
        assertEquals("Make it red", stored.getOriginalRequest());
        assertEquals("<script></script>", stored.getPlaceholders().get("__sc1__"));
        assertEquals(1, stored.getTurns().size());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), stored.getCreatedAt());
    }

    @Test
    void shouldWriteWithoutExpiryWhenTtlIsZero() {
        RedisSessionStore store = new RedisSessionStore(redis, objectMapper, Duration.ZERO);

        store.set("s1", AgentSession.builder().id("s1").build());

        verify(values).set(eq("lemur:session:s1"), anyString());
    }

    @Test
    void shouldReadBackStatus() throws Exception {
        AgentSession session = AgentSession.builder().id("s1").build();
        session.transitionTo(SessionStatus.PROCESSING);
        when(values.get("lemur:session:s1")).thenReturn(objectMapper.writeValueAsString(session));
        RedisSessionStore store = new RedisSessionStore(redis, objectMapper, Duration.ofHours(1));

        Optional<AgentSession> loaded = store.get("s1");

        assertTrue(loaded.isPresent());
        assertEquals(SessionStatus.PROCESSING, loaded.get().getStatus());
    }

    @Test
    void shouldReturnEmptyForMissingKey() {
        RedisSessionStore store = new RedisSessionStore(redis, objectMapper, Duration.ofHours(1));

        assertTrue(store.get("nope").isEmpty());
    }

    @Test
    void shouldRejectCorruptRecord() {
        when(values.get("lemur:session:s1")).thenReturn("{not json");
        RedisSessionStore store = new RedisSessionStore(redis, objectMapper, Duration.ofHours(1));

        assertThrows(IllegalStateException.class, () -> store.get("s1"));
    }
}
