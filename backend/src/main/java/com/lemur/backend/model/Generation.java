package com.lemur.backend.model;

/**
 * Parsed completion backend answer. {@code edits} is null when there is nothing to apply.
 */
public record Generation(GenerationStatus status, String message, String edits) {

    public static Generation appliedEdit(String message, String edits) {
        return new Generation(GenerationStatus.APPLIED_EDIT, message, edits);
    }

    public static Generation completed(String message) {
        return new Generation(GenerationStatus.COMPLETED, message, null);
    }

    public static Generation error(String message) {
        return new Generation(GenerationStatus.ERROR, message, null);
    }
}
