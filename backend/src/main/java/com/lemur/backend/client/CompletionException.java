package com.lemur.backend.client;

/**
 * Transport or protocol failure talking to a completion backend.
 */
public class CompletionException extends RuntimeException {

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
