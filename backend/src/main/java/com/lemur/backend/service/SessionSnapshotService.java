package com.lemur.backend.service;

import com.lemur.backend.model.AgentSession;
import com.lemur.backend.model.SessionSnapshot;
import com.lemur.backend.repository.SessionSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists a full copy of a session when it ends, whatever the outcome.
 */
@Service
public class SessionSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SessionSnapshotService.class);

    private final SessionSnapshotRepository snapshotRepository;

    public SessionSnapshotService(SessionSnapshotRepository snapshotRepository) {
        this.snapshotRepository = snapshotRepository;
    }

    /**
     * Save a snapshot. Failures are logged, never thrown: a lost snapshot must not
     * change how the session ends.
     */
    public void save(AgentSession session) {
        try {
            SessionSnapshot snapshot = SessionSnapshot.builder()
                    .sessionId(session.getId())
                    .finalStatus(session.getStatus())
                    .totalTurns(session.getTurns().size())
                    .originalRequest(session.getOriginalRequest())
                    .session(session)
                    .build();

            snapshot = snapshotRepository.save(snapshot);
            log.info("[AGENT] Session {} snapshot saved: {} | status: {}",
                    session.getId(), snapshot.getId(), session.getStatus());
        } catch (Exception e) {
            log.error("[AGENT] Failed to save snapshot for session {}: {}", session.getId(), e.getMessage());
        }
    }

    public List<SessionSnapshot> findBySessionId(String sessionId) {
        return snapshotRepository.findBySessionIdOrderBySavedAtDesc(sessionId);
    }
}
