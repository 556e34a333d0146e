package com.lemur.backend.controller;

import com.lemur.backend.dto.SessionResponse;
import com.lemur.backend.dto.StartAgentRequest;
import com.lemur.backend.dto.StartAgentResponse;
import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.SessionSnapshot;
import com.lemur.backend.service.AgentSessionService;
import com.lemur.backend.service.SessionSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/agent")
@Tag(name = "Agent", description = "Agent editing sessions")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentSessionService sessionService;
    private final SessionSnapshotService snapshotService;

    public AgentController(AgentSessionService sessionService, SessionSnapshotService snapshotService) {
        this.sessionService = sessionService;
        this.snapshotService = snapshotService;
    }

    @PostMapping("/start")
    @Operation(summary = "Start session", description = "Create an editing session; connect to /agent/{sessionId}/ws to run it")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session created"),
            @ApiResponse(responseCode = "400", description = "Invalid request or unknown backend"),
            @ApiResponse(responseCode = "500", description = "Session could not be stored")
    })
    public ResponseEntity<?> startSession(@Valid @RequestBody StartAgentRequest request) {
        try {
            AgentSession session = sessionService.createSession(
                    request.getHtml(), request.getQuery(), request.getModelType(), request.getInitialScreenshot());
            return ResponseEntity.ok(StartAgentResponse.builder()
                    .sessionId(session.getId())
                    .message("Session created. Connect to WebSocket to start processing.")
                    .build());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            log.error("[AGENT] Failed to create session: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get session", description = "Current status and document of a session")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session found"),
            @ApiResponse(responseCode = "404", description = "Session not found")
    })
    public ResponseEntity<SessionResponse> getSession(
            @Parameter(description = "Session ID") @PathVariable String sessionId) {

        return sessionService.find(sessionId)
                .map(session -> ResponseEntity.ok(SessionResponse.from(session)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{sessionId}/snapshots")
    @Operation(summary = "List snapshots", description = "Snapshots saved when the session ended, newest first")
    public ResponseEntity<List<SessionSnapshot>> getSnapshots(
            @Parameter(description = "Session ID") @PathVariable String sessionId) {

        return ResponseEntity.ok(snapshotService.findBySessionId(sessionId));
    }
}
