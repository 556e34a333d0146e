package com.lemur.backend.client;

/**
 * Prompt text plus an optional base64 PNG screenshot.
 */
public record CompletionRequest(String prompt, String imageBase64) {

    public static CompletionRequest textOnly(String prompt) {
        return new CompletionRequest(prompt, null);
    }

    public boolean hasImage() {
        return imageBase64 != null && !imageBase64.isEmpty();
    }
}
