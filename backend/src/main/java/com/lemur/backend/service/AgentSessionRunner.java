package com.lemur.backend.service;

import com.lemur.backend.websocket.ObservationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs at most one agent loop per session on the agent executor.
 */
@Service
public class AgentSessionRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentSessionRunner.class);

    private final AgentLoopService agentLoopService;
    private final ObservationChannel observationChannel;
    private final ThreadPoolTaskExecutor executor;

    private final Map<String, LoopTask> running = new ConcurrentHashMap<>();

    public AgentSessionRunner(AgentLoopService agentLoopService,
            ObservationChannel observationChannel,
            @Qualifier("agentLoopExecutor") ThreadPoolTaskExecutor executor) {
        this.agentLoopService = agentLoopService;
        this.observationChannel = observationChannel;
        this.executor = executor;
    }

    /**
     * Submit the loop for {@code sessionId}.
     *
     * @return false if a loop for the session is already running
     * @throws TaskRejectedException if the executor is saturated
     */
    public boolean start(String sessionId) {
        boolean[] submitted = {false};
        running.computeIfAbsent(sessionId, id -> {
            LoopTask task = new LoopTask();
            task.future = executor.submit(() -> runAndRelease(id, task));
            submitted[0] = true;
            return task;
        });
        if (submitted[0]) {
            log.info("[AGENT] Loop submitted for session {}", sessionId);
        }
        return submitted[0];
    }

    /**
     * Cancel the session's loop, if any. A running loop is interrupted and records the
     * cancellation itself; a loop still queued on the executor is dropped and recorded here.
     */
    public void cancel(String sessionId) {
        LoopTask task = running.get(sessionId);
        if (task == null || task.future.isDone()) {
            return;
        }
        if (task.claimed.compareAndSet(false, true)) {
            log.info("[AGENT] Dropping queued loop for session {}", sessionId);
            task.future.cancel(false);
            try {
                agentLoopService.recordCancelledBeforeStart(sessionId);
            } finally {
                release(sessionId, task);
            }
            return;
        }
        log.info("[AGENT] Cancelling loop for session {}", sessionId);
        task.future.cancel(true);
    }

    public boolean isRunning(String sessionId) {
        return running.containsKey(sessionId);
    }

    private void runAndRelease(String sessionId, LoopTask task) {
        if (!task.claimed.compareAndSet(false, true)) {
            return;
        }
        try {
            agentLoopService.run(sessionId);
        } finally {
            release(sessionId, task);
            log.info("[AGENT] Loop finished for session {}", sessionId);
        }
    }

    private void release(String sessionId, LoopTask task) {
        // Disconnect before releasing the slot so a new socket cannot be dropped by this cleanup
        observationChannel.disconnect(sessionId);
        running.remove(sessionId, task);
    }

    /**
     * A submitted loop. Whichever of the worker or {@link #cancel} claims it first owns the cleanup.
     */
    private static final class LoopTask {
        private final AtomicBoolean claimed = new AtomicBoolean(false);
        private volatile Future<?> future;
    }
}
