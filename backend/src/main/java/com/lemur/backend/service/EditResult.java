package com.lemur.backend.service;

/**
 * Output of one edit: the restored document for display and the shielded text that
 * becomes the next turn's baseline.
 */
public record EditResult(String finalDocument, String shieldedDocument) {
}
