package com.example.coa.domain.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update for a stored record. {@code null} attributes are left untouched; field and
 * additional-field entries are merged key by key into the stored maps, never replacing them wholesale.
 */
public record CoaRecordPatch(
        String fileName,
        String sampleId,
        String batchId,
        Integer extractionPhase,
        String documentType,
        Map<String, String> fields,
        Map<String, Object> additionalFields
) {

    public CoaRecordPatch {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        additionalFields = additionalFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }
}
