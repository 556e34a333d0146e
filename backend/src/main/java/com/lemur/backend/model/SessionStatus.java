package com.lemur.backend.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of an agent session.
 */
public enum SessionStatus {
    CREATED,
    PROCESSING,
    APPLIED_EDIT,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    /**
     * Terminal states have no exits and nothing returns to CREATED.
     * APPLIED_EDIT is only reachable from PROCESSING.
     */
    public boolean canTransitionTo(SessionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<SessionStatus> allowedNext() {
        return switch (this) {
            case CREATED -> EnumSet.of(PROCESSING, COMPLETED, ERROR);
            case PROCESSING -> EnumSet.of(APPLIED_EDIT, COMPLETED, ERROR);
            case APPLIED_EDIT -> EnumSet.of(PROCESSING, COMPLETED, ERROR);
            case COMPLETED, ERROR -> EnumSet.noneOf(SessionStatus.class);
        };
    }
}
