package com.lemur.backend.client;

/**
 * The patch service could not apply an edit: unreachable, malformed or empty result.
 */
public class PatchException extends RuntimeException {

    public PatchException(String message) {
        super(message);
    }

    public PatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
