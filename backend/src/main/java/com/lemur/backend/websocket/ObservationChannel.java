package com.lemur.backend.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lemur.backend.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session conduit between the agent loop and its WebSocket.
 * <p>
 * Sends for one session are serialized by that session's lock; there is no cross-session
 * locking. Inbound frames are queued, up to {@value #INBOX_CAPACITY} per session, and handed to
 * {@link #receiveWithTimeout}, which expects a single caller per session.
 */
@Component
public class ObservationChannel {

    private static final Logger log = LoggerFactory.getLogger(ObservationChannel.class);

    static final int INBOX_CAPACITY = 16;

    private final ObjectMapper objectMapper;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public ObservationChannel(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void connect(String sessionId, WebSocketSession socket) {
        Connection previous = connections.put(sessionId, new Connection(socket));
        if (previous != null && previous.socket != socket) {
            close(sessionId, previous.socket);
        }
        log.info("[WS] Connected session: {} socket: {}", sessionId, socket.getId());
    }

    /**
     * Drop the connection and close its socket. Safe to call more than once.
     */
    public void disconnect(String sessionId) {
        Connection connection = connections.remove(sessionId);
        if (connection == null) {
            return;
        }
        close(sessionId, connection.socket);
        log.info("[WS] Disconnected session: {}", sessionId);
    }

    /**
     * Drop the connection only if it still belongs to {@code socket}.
     *
     * @return true if this call removed the session's connection
     */
    public boolean disconnectIfCurrent(String sessionId, WebSocketSession socket) {
        boolean[] removed = {false};
        connections.computeIfPresent(sessionId, (id, connection) -> {
            if (connection.socket != socket) {
                return connection;
            }
            removed[0] = true;
            return null;
        });
        if (removed[0]) {
            close(sessionId, socket);
            log.info("[WS] Disconnected session: {}", sessionId);
        }
        return removed[0];
    }

    public boolean isConnected(String sessionId) {
        return connections.containsKey(sessionId);
    }

    /**
     * Send an event. A failed write disconnects the session and returns false instead of throwing.
     */
    public boolean send(String sessionId, AgentWireMessage message) {
        Connection connection = connections.get(sessionId);
        if (connection == null) {
            log.warn("[WS] No connection for session: {} (dropping {} event)", sessionId, message.getType());
            return false;
        }

        try {
            TextMessage frame = new TextMessage(objectMapper.writeValueAsString(message));
            connection.sendLock.lock();
            try {
                connection.socket.sendMessage(frame);
            } finally {
                connection.sendLock.unlock();
            }
            log.debug("[WS] Sent {} event to session: {}", message.getType(), sessionId);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("[WS] Failed to send {} event to session {}: {}", message.getType(), sessionId, e.getMessage());
            disconnect(sessionId);
            return false;
        }
    }

    /**
     * Queue a raw inbound frame for the session's next receive.
     */
    public void deliver(String sessionId, String payload) {
        Connection connection = connections.get(sessionId);
        if (connection == null) {
            log.warn("[WS] Inbound frame for unknown session: {}", sessionId);
            return;
        }
        if (!connection.inbox.offer(payload)) {
            log.warn("[WS] Inbox full for session {} ({} frames pending), dropping frame", sessionId, INBOX_CAPACITY);
        }
    }

    /**
     * Wait up to {@code timeout} for the next frame. Empty on timeout, when the session has no
     * connection, or when the frame is not a well-formed observation.
     */
    public Optional<Observation> receiveWithTimeout(String sessionId, Duration timeout) throws InterruptedException {
        Connection connection = connections.get(sessionId);
        if (connection == null) {
            return Optional.empty();
        }

        String payload = connection.inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (payload == null) {
            return Optional.empty();
        }

        InboundMessage message;
        try {
            message = objectMapper.readValue(payload, InboundMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("[WS] Ignoring malformed frame from session {}: {}", sessionId, e.getOriginalMessage());
            return Optional.empty();
        }

        if (!InboundMessage.OBSERVATION.equals(message.getType()) || message.getData() == null) {
            log.warn("[WS] Ignoring {} frame from session {}", message.getType(), sessionId);
            return Optional.empty();
        }
        return Optional.of(new Observation(message.getData().getSummary(), message.getData().getScreenshot()));
    }

    private void close(String sessionId, WebSocketSession socket) {
        if (!socket.isOpen()) {
            return;
        }
        try {
            socket.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("[WS] Failed to close socket for session {}: {}", sessionId, e.getMessage());
        }
    }

    private static final class Connection {
        private final WebSocketSession socket;
        private final ReentrantLock sendLock = new ReentrantLock();
        private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>(INBOX_CAPACITY);

        private Connection(WebSocketSession socket) {
            this.socket = socket;
        }
    }
}
