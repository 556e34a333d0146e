package com.lemur.backend.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All completion backends known to the process, keyed by name.
 */
@Component
public class CompletionBackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(CompletionBackendRegistry.class);

    private final Map<String, CompletionBackend> backends = new LinkedHashMap<>();
    private final String defaultBackend;

    public CompletionBackendRegistry(List<CompletionBackend> backends,
            @Value("${agent.completion.default-backend:openrouter}") String defaultBackend) {
        for (CompletionBackend backend : backends) {
            this.backends.put(backend.name(), backend);
        }
        this.defaultBackend = defaultBackend;
        log.info("[ORACLE] Registered completion backends: {} | default: {}", this.backends.keySet(), defaultBackend);
    }

    /**
     * Resolve a backend name, falling back to the configured default when blank.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public CompletionBackend resolve(String name) {
        String key = name == null || name.isBlank() ? defaultBackend : name.trim().toLowerCase();
        CompletionBackend backend = backends.get(key);
        if (backend == null) {
            throw new IllegalArgumentException("Unknown completion backend: " + key + " (available: " + names() + ")");
        }
        return backend;
    }

    public Set<String> names() {
        return backends.keySet();
    }
}
