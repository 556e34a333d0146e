package com.lemur.backend.shield;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of shielding a document: the tokenized text plus token to original fragment.
 */
public record ShieldedDocument(String shielded, Map<String, String> placeholders) {

    public ShieldedDocument {
        placeholders = Collections.unmodifiableMap(new LinkedHashMap<>(placeholders));
    }
}
