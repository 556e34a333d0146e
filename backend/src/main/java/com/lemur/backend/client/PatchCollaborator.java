package com.lemur.backend.client;

/**
 * External service that merges patch instructions into a full document.
 */
public interface PatchCollaborator {

    /**
     * @return the patched document
     * @throws PatchException when the service fails or returns nothing usable; never retried
     */
    String apply(String document, String editInstructions) throws InterruptedException;
}
