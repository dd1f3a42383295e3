package com.example.coa.domain.model;

/**
 * Sample/batch identifier pair as found in a document or a file name. Either side may be {@code null}.
 */
public record SampleIdentifiers(String sampleId, String batchId) {

    public static SampleIdentifiers empty() {
        return new SampleIdentifiers(null, null);
    }

    public boolean isComplete() {
        return sampleId != null && batchId != null;
    }
}
