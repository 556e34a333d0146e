package com.lemur.backend.service;

import com.lemur.backend.client.CompletionBackend;
import com.lemur.backend.client.CompletionBackendRegistry;
import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.ConversationTurn;
import com.lemur.backend.model.Generation;
import com.lemur.backend.model.Observation;
import com.lemur.backend.model.SessionStatus;
import com.lemur.backend.store.SessionNotFoundException;
import com.lemur.backend.websocket.AgentWireMessage;
import com.lemur.backend.websocket.ObservationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Drives one session from its current state to {@code completed} or {@code error}:
 * ask the oracle, apply the edit, publish it, wait for an observation, repeat.
 * <p>
 * A single call to {@link #run(String)} owns the session for its whole lifetime. Nothing is retried;
 * every failure ends the session with an {@code error} event, and every ending except a vanished
 * session leaves a snapshot behind.
 */
@Service
public class AgentLoopService {

    private static final Logger log = LoggerFactory.getLogger(AgentLoopService.class);

    public static final String MAX_ITERATIONS_MESSAGE = "Reached maximum iterations";
    public static final String CANCELLED_MESSAGE = "Session cancelled: connection closed";

    private final AgentSessionService sessionService;
    private final CompletionBackendRegistry backendRegistry;
    private final CompletionOracle completionOracle;
    private final EditApplicationService editApplicationService;
    private final ObservationChannel observationChannel;
    private final SessionSnapshotService snapshotService;
    private final AttachmentStorageService attachmentStorageService;
    private final Duration observationTimeout;

    public AgentLoopService(AgentSessionService sessionService,
            CompletionBackendRegistry backendRegistry,
            CompletionOracle completionOracle,
            EditApplicationService editApplicationService,
            ObservationChannel observationChannel,
            SessionSnapshotService snapshotService,
            AttachmentStorageService attachmentStorageService,
            @Value("${agent.observation.timeout:30s}") Duration observationTimeout) {
        this.sessionService = sessionService;
        this.backendRegistry = backendRegistry;
        this.completionOracle = completionOracle;
        this.editApplicationService = editApplicationService;
        this.observationChannel = observationChannel;
        this.snapshotService = snapshotService;
        this.attachmentStorageService = attachmentStorageService;
        this.observationTimeout = observationTimeout;
    }

    /**
     * Run the loop on the calling thread until the session ends. Interrupting the thread cancels
     * the session; the interrupt flag is restored before returning.
     */
    public void run(String sessionId) {
        log.info("[AGENT] Starting loop for session {}", sessionId);
        try {
            CompletionBackend backend = backendRegistry.resolve(sessionService.require(sessionId).getBackend());

            while (true) {
                AgentSession session = sessionService.require(sessionId);

                if (session.getStatus().isTerminal()) {
                    log.info("[AGENT] Session {} already {}, leaving loop", sessionId, session.getStatus());
                    observationChannel.send(sessionId, terminalEvent(session));
                    return;
                }

                if (session.getCurrentIteration() >= session.getMaxIterations()) {
                    log.info("[AGENT] Session {} reached max iterations ({})", sessionId, session.getMaxIterations());
                    complete(sessionId, MAX_ITERATIONS_MESSAGE);
                    return;
                }

                if (session.isAwaitingObservation()) {
                    awaitObservation(sessionId);
                    continue;
                }

                if (!runTurn(session, backend)) {
                    return;
                }
            }
        } catch (SessionNotFoundException e) {
            log.error("[AGENT] Session {} disappeared from the store", sessionId);
            observationChannel.send(sessionId, AgentWireMessage.error(e.getMessage()));
        } catch (InterruptedException e) {
            log.warn("[AGENT] Session {} cancelled", sessionId);
            fail(sessionId, CANCELLED_MESSAGE);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (Thread.interrupted()) {
                log.warn("[AGENT] Session {} cancelled during an external call: {}", sessionId, e.getMessage());
                fail(sessionId, CANCELLED_MESSAGE);
                Thread.currentThread().interrupt();
            } else {
                log.error("[AGENT] Loop failed for session {}", sessionId, e);
                fail(sessionId, "Error: " + e.getMessage());
            }
        }
    }

    /**
     * Record a cancellation for a session whose loop was dropped before it ever ran.
     * Sessions that are gone or already finished are left untouched.
     */
    public void recordCancelledBeforeStart(String sessionId) {
        Optional<AgentSession> session = sessionService.find(sessionId);
        if (session.isEmpty() || session.get().getStatus().isTerminal()) {
            log.info("[AGENT] Queued loop for session {} dropped, nothing to record", sessionId);
            return;
        }
        log.warn("[AGENT] Session {} cancelled before its loop started", sessionId);
        fail(sessionId, CANCELLED_MESSAGE);
    }

    private static AgentWireMessage terminalEvent(AgentSession session) {
        return session.getStatus() == SessionStatus.COMPLETED
                ? AgentWireMessage.completed(session.getMessage())
                : AgentWireMessage.error(session.getMessage());
    }

    /**
     * One oracle turn.
     *
     * @return false once the session has reached a terminal state
     */
    private boolean runTurn(AgentSession session, CompletionBackend backend) throws InterruptedException {
        String sessionId = session.getId();
        if (session.getStatus() != SessionStatus.PROCESSING) {
            session = sessionService.update(sessionId, s -> s.transitionTo(SessionStatus.PROCESSING));
        }

        Generation generation = completionOracle.generate(session, backend);
        return switch (generation.status()) {
            case COMPLETED -> {
                complete(sessionId, generation.message());
                yield false;
            }
            case ERROR -> {
                fail(sessionId, generation.message());
                yield false;
            }
            case APPLIED_EDIT -> {
                applyEdit(session, generation);
                yield true;
            }
        };
    }

    private void applyEdit(AgentSession session, Generation generation) throws InterruptedException {
        String sessionId = session.getId();
        String finalDocument = session.getCurrentDocument();
        String shieldedDocument = session.getCurrentShieldedDocument();

        if (generation.edits() != null) {
            EditResult result = editApplicationService.apply(
                    shieldedDocument, generation.edits(), session.getPlaceholders());
            finalDocument = result.finalDocument();
            shieldedDocument = result.shieldedDocument();
        } else {
            log.info("[AGENT] Session {} turn carried no edits, document unchanged", sessionId);
        }

        String document = finalDocument;
        String shielded = shieldedDocument;
        AgentSession updated = sessionService.update(sessionId, s -> {
            s.getTurns().add(ConversationTurn.agent(generation.message(), generation.edits()));
            s.setCurrentIteration(s.getCurrentIteration() + 1);
            s.setCurrentDocument(document);
            s.setCurrentShieldedDocument(shielded);
            s.setMessage(generation.message());
            s.setAwaitingObservation(true);
            s.transitionTo(SessionStatus.APPLIED_EDIT);
        });

        log.info("[AGENT] Session {} applied edit {}/{}",
                sessionId, updated.getCurrentIteration(), updated.getMaxIterations());
        observationChannel.send(sessionId,
                AgentWireMessage.applyEdit(document, generation.message(), updated.getCurrentIteration()));
    }

    private void awaitObservation(String sessionId) throws InterruptedException {
        Optional<Observation> observation = observationChannel.receiveWithTimeout(sessionId, observationTimeout);

        if (observation.isEmpty()) {
            log.warn("[AGENT] No observation for session {} within {}, continuing without feedback",
                    sessionId, observationTimeout);
            sessionService.update(sessionId, s -> {
                s.setAwaitingObservation(false);
                s.transitionTo(SessionStatus.PROCESSING);
            });
            return;
        }

        Observation received = observation.get();
        String attachmentId = received.hasScreenshot()
                ? attachmentStorageService.storeScreenshot(sessionId, received.screenshot())
                : null;
        log.info("[AGENT] Observation received for session {} | screenshot: {}", sessionId, attachmentId != null);

        sessionService.update(sessionId, s -> {
            s.getTurns().add(ConversationTurn.user(received.summary(), attachmentId));
            s.setAwaitingObservation(false);
            s.transitionTo(SessionStatus.PROCESSING);
        });
    }

    private void complete(String sessionId, String message) {
        AgentSession session = sessionService.update(sessionId, s -> {
            s.transitionTo(SessionStatus.COMPLETED);
            s.setMessage(message);
            s.setAwaitingObservation(false);
            s.setCompletedAt(Instant.now());
        });
        snapshotService.save(session);
        observationChannel.send(sessionId, AgentWireMessage.completed(message));
        log.info("[AGENT] Session {} completed: {}", sessionId, message);
    }

    /**
     * Write the error state and emit the error event. A store failure here is logged; the event
     * is still sent.
     */
    private void fail(String sessionId, String message) {
        log.error("[AGENT] Session {} failed: {}", sessionId, message);
        try {
            AgentSession session = sessionService.update(sessionId, s -> {
                s.transitionTo(SessionStatus.ERROR);
                s.setMessage(message);
                s.setAwaitingObservation(false);
                s.setCompletedAt(Instant.now());
            });
            snapshotService.save(session);
        } catch (RuntimeException e) {
            log.error("[AGENT] Could not record error state for session {}: {}", sessionId, e.getMessage());
        }
        observationChannel.send(sessionId, AgentWireMessage.error(message));
    }
}
