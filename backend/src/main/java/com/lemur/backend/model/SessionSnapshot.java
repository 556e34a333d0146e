package com.lemur.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Full copy of a session record taken when the session ends, kept for post-mortems.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "session_snapshots")
public class SessionSnapshot {

    @Id
    private String id;

    @Indexed
    private String sessionId;

    private SessionStatus finalStatus;

    private int totalTurns;

    private String originalRequest;

    private AgentSession session;

    @CreatedDate
    private Instant savedAt;
}
