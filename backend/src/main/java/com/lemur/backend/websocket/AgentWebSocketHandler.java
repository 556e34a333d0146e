package com.lemur.backend.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lemur.backend.service.AgentSessionRunner;
import com.lemur.backend.service.AgentSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * WebSocket endpoint {@code /agent/{sessionId}/ws}. Connecting starts the session's loop;
 * disconnecting cancels it.
 */
@Component
public class AgentWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AgentWebSocketHandler.class);

    private final ObservationChannel observationChannel;
    private final AgentSessionRunner sessionRunner;
    private final AgentSessionService sessionService;
    private final ObjectMapper objectMapper;

    private final Object connectLock = new Object();

    public AgentWebSocketHandler(ObservationChannel observationChannel,
            AgentSessionRunner sessionRunner,
            AgentSessionService sessionService,
            ObjectMapper objectMapper) {
        this.observationChannel = observationChannel;
        this.sessionRunner = sessionRunner;
        this.sessionService = sessionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) throws IOException {
        String sessionId = extractSessionId(socket);
        if (sessionId == null) {
            socket.close(CloseStatus.BAD_DATA.withReason("Missing session id"));
            return;
        }

        if (sessionService.find(sessionId).isEmpty()) {
            log.warn("[WS] Connection for unknown session: {}", sessionId);
            sendDirect(socket, AgentWireMessage.error("Session not found"));
            socket.close(CloseStatus.NORMAL);
            return;
        }

        synchronized (connectLock) {
            if (sessionRunner.isRunning(sessionId)) {
                log.warn("[WS] Refusing second connection for session: {}", sessionId);
                socket.close(CloseStatus.POLICY_VIOLATION.withReason("Session already has an active connection"));
                return;
            }

            observationChannel.connect(sessionId, socket);
            try {
                sessionRunner.start(sessionId);
            } catch (TaskRejectedException e) {
                log.error("[WS] Agent executor rejected session {}: {}", sessionId, e.getMessage());
                observationChannel.send(sessionId, AgentWireMessage.error("Server busy, try again later"));
                observationChannel.disconnect(sessionId);
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        String sessionId = extractSessionId(socket);
        if (sessionId == null) {
            return;
        }
        if (observationChannel.disconnectIfCurrent(sessionId, socket)) {
            log.info("[WS] Client closed session {} ({}), cancelling loop", sessionId, status);
            sessionRunner.cancel(sessionId);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        String sessionId = extractSessionId(socket);
        if (sessionId == null) {
            return;
        }
        log.debug("[WS] Received frame for session {} ({} chars)", sessionId, message.getPayloadLength());
        observationChannel.deliver(sessionId, message.getPayload());
    }

    private void sendDirect(WebSocketSession socket, AgentWireMessage message) throws IOException {
        socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }

    /**
     * Session id from a path of the form /agent/{sessionId}/ws.
     */
    static String extractSessionId(WebSocketSession socket) {
        if (socket.getUri() == null) {
            return null;
        }
        String[] parts = socket.getUri().getPath().split("/");
        if (parts.length >= 4 && "agent".equals(parts[1]) && "ws".equals(parts[3]) && !parts[2].isBlank()) {
            return parts[2];
        }
        return null;
    }
}
