package com.example.coa.domain.model;

import java.util.Optional;

/**
 * Keys of the flat extraction result that carry record metadata rather than parameter values.
 */
public enum ReservedKey {
    SAMPLE_ID("sample_id"),
    BATCH_ID("batch_id"),
    EXTRACTION_PHASE("extraction_phase"),
    DOCUMENT_TYPE("document_type");

    private final String key;

    ReservedKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<ReservedKey> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (ReservedKey reserved : values()) {
            if (reserved.key.equals(key)) {
                return Optional.of(reserved);
            }
        }
        return Optional.empty();
    }
}
