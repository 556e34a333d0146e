package com.lemur.backend.model;

/**
 * Feedback from the front end after an edit was shown. {@code screenshot} is base64, optional.
 */
public record Observation(String summary, String screenshot) {

    public boolean hasScreenshot() {
        return screenshot != null && !screenshot.isBlank();
    }
}
