package com.lemur.backend.service;

import com.lemur.backend.client.CompletionBackendRegistry;
import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.SessionStatus;
import com.lemur.backend.shield.ContentShield;
import com.lemur.backend.shield.ShieldedDocument;
import com.lemur.backend.store.SessionNotFoundException;
import com.lemur.backend.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Creates session records and is the only place that writes them back.
 */
@Service
public class AgentSessionService {

    private static final Logger log = LoggerFactory.getLogger(AgentSessionService.class);

    private final SessionStore sessionStore;
    private final ContentShield contentShield;
    private final CompletionBackendRegistry backendRegistry;
    private final AttachmentStorageService attachmentStorageService;
    private final int maxIterations;

    public AgentSessionService(SessionStore sessionStore,
            ContentShield contentShield,
            CompletionBackendRegistry backendRegistry,
            AttachmentStorageService attachmentStorageService,
            @Value("${agent.session.max-iterations:10}") int maxIterations) {
        this.sessionStore = sessionStore;
        this.contentShield = contentShield;
        this.backendRegistry = backendRegistry;
        this.attachmentStorageService = attachmentStorageService;
        this.maxIterations = maxIterations;
    }

    /**
     * Shield the document once and store a fresh session.
     *
     * @throws IllegalArgumentException if {@code backend} names no registered backend
     * @throws IllegalStateException    if the store rejects the write
     */
    public AgentSession createSession(String document, String request, String backend, String initialScreenshot) {
        String backendName = backendRegistry.resolve(backend).name();
        ShieldedDocument shielded = contentShield.protect(document);
        String sessionId = UUID.randomUUID().toString();

        String screenshotId = null;
        if (initialScreenshot != null && !initialScreenshot.isBlank()) {
            screenshotId = attachmentStorageService.storeScreenshot(sessionId, initialScreenshot);
        }

        Instant now = Instant.now();
        AgentSession session = AgentSession.builder()
                .id(sessionId)
                .backend(backendName)
                .maxIterations(maxIterations)
                .originalDocument(document)
                .currentDocument(document)
                .shieldedDocument(shielded.shielded())
                .currentShieldedDocument(shielded.shielded())
                .placeholders(shielded.placeholders())
                .originalRequest(request)
                .initialScreenshotId(screenshotId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (!sessionStore.set(sessionId, session)) {
            throw new IllegalStateException("Failed to save session to store");
        }
        log.info("[AGENT] Created session {} | backend: {} | placeholders: {} | max iterations: {}",
                sessionId, backendName, shielded.placeholders().size(), maxIterations);
        return session;
    }

    public Optional<AgentSession> find(String sessionId) {
        return sessionStore.get(sessionId);
    }

    public AgentSession require(String sessionId) {
        return sessionStore.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Read, mutate, stamp and write back. Status changes inside {@code mutation} must go through
     * {@link AgentSession#transitionTo(SessionStatus)}.
     *
     * @return the stored record
     */
    public AgentSession update(String sessionId, Consumer<AgentSession> mutation) {
        AgentSession session = require(sessionId);
        mutation.accept(session);
        session.setRevision(session.getRevision() + 1);
        session.setUpdatedAt(Instant.now());

        if (!sessionStore.set(sessionId, session)) {
            throw new IllegalStateException("Failed to save session " + sessionId);
        }
        return session;
    }
}
