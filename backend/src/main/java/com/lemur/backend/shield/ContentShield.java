package com.lemur.backend.shield;

import java.util.Map;

/**
 * Hides structurally fragile document regions from external services.
 * <p>
 * {@link #protect(String)} swaps each fragile span for a short stable token and
 * {@link #restore(String, Map)} puts the original markup back. Implementations
 * are free to work on text patterns or on a parsed tree; callers only see the
 * token map.
 */
public interface ContentShield {

    /**
     * Remove comments and replace fragile spans with placeholder tokens.
     */
    ShieldedDocument protect(String document);

    /**
     * Replace every placeholder token in {@code text} with its original fragment.
     */
    String restore(String text, Map<String, String> placeholders);
}
