package com.example.coa.domain.model;

/**
 * Outcome of one document inside an upload batch.
 */
public enum FileProcessingStatus {
    PERSISTED,
    REJECTED,
    EXTRACTION_FAILED,
    PERSISTENCE_FAILED;

    public boolean isSuccess() {
        return this == PERSISTED;
    }
}
