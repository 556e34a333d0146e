package com.lemur.backend.model;

/**
 * Author of a conversation turn.
 */
public enum TurnRole {
    USER,
    AGENT
}
