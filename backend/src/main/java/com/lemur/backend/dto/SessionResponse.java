package com.lemur.backend.dto;

import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.SessionStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Status view of a session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Agent session status")
public class SessionResponse {

    @Schema(description = "Session ID")
    private String id;

    @Schema(description = "Current status")
    private SessionStatus status;

    @Schema(description = "Completion backend")
    private String backend;

    @Schema(description = "Edits applied so far")
    private int currentIteration;

    @Schema(description = "Iteration limit")
    private int maxIterations;

    @Schema(description = "Latest document")
    private String currentDocument;

    @Schema(description = "Last agent or terminal message")
    private String message;

    @Schema(description = "Number of logged turns")
    private int totalTurns;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public static SessionResponse from(AgentSession session) {
        return SessionResponse.builder()
                .id(session.getId())
                .status(session.getStatus())
                .backend(session.getBackend())
                .currentIteration(session.getCurrentIteration())
                .maxIterations(session.getMaxIterations())
                .currentDocument(session.getCurrentDocument())
                .message(session.getMessage())
                .totalTurns(session.getTurns().size())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .completedAt(session.getCompletedAt())
                .build();
    }
}
