package com.lemur.backend.store;

import com.lemur.backend.model.AgentSession;

import java.util.Optional;

/**
 * Key-value persistence for session records.
 * Implementations must isolate keys from one another; a write is visible to the
 * writer's next read.
 */
public interface SessionStore {

    Optional<AgentSession> get(String sessionId);

    boolean set(String sessionId, AgentSession session);
}
