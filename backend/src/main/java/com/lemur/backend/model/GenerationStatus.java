package com.lemur.backend.model;

/**
 * Outcome reported by a completion backend for one turn.
 */
public enum GenerationStatus {
    APPLIED_EDIT,
    COMPLETED,
    ERROR
}
