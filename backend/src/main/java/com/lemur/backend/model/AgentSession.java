package com.lemur.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session record driven by the agent loop.
 * <p>
 * {@code currentShieldedDocument} is what the completion backend sees; it is always
 * the previous edit's patched output and is never recomputed from
 * {@code currentDocument}. The placeholder map is fixed at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSession {

    private String id;

    @JsonProperty
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private SessionStatus status = SessionStatus.CREATED;

    /**
     * Incremented on every write through the session service.
     */
    @Builder.Default
    private long revision = 0;

    /**
     * Name of the completion backend, fixed at creation.
     */
    private String backend;

    private int maxIterations;

    @Builder.Default
    private int currentIteration = 0;

    private String originalDocument;
    private String currentDocument;
    private String shieldedDocument;
    private String currentShieldedDocument;

    @JsonProperty
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Map<String, String> placeholders = new LinkedHashMap<>();

    private String originalRequest;

    /**
     * GridFS id of the screenshot supplied when the session was started.
     */
    private String initialScreenshotId;

    @Builder.Default
    private List<ConversationTurn> turns = new ArrayList<>();

    @Builder.Default
    private boolean awaitingObservation = false;

    /**
     * Last agent or terminal message.
     */
    private String message;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public Map<String, String> getPlaceholders() {
        return Collections.unmodifiableMap(placeholders);
    }

    /**
     * Move to {@code next}, rejecting transitions {@link SessionStatus} does not allow.
     */
    public void transitionTo(SessionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal status transition for session " + id + ": " + status + " -> " + next);
        }
        this.status = next;
    }
}
