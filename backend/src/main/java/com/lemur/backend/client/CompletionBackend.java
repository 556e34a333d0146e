package com.lemur.backend.client;

/**
 * One concrete text-completion service. Implementations return the raw generated text;
 * parsing it is the caller's job.
 */
public interface CompletionBackend {

    /**
     * Name sessions use to select this backend, e.g. {@code openrouter}.
     */
    String name();

    /**
     * @throws CompletionException when the service is unreachable or answers with something unusable
     */
    String complete(CompletionRequest request) throws InterruptedException;
}
