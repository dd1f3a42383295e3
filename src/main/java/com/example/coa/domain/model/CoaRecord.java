package com.example.coa.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted COA record as held by the record store.
 *
 * @param id                store-assigned identifier
 * @param userId            owning user, {@code null} for legacy unowned rows
 * @param fileName          last file that wrote to this record
 * @param sampleId          stored sample identifier (raw, not normalized)
 * @param batchId           stored batch identifier
 * @param extractionPhase   phase of the last extraction merged into the record
 * @param documentType      display name of the last detected document type, may be {@code null}
 * @param fields            canonical column name to value
 * @param additionalFields  values without a canonical column
 * @param createdAt         creation time
 * @param updatedAt         time of the last update
 */
public record CoaRecord(
        String id,
        String userId,
        String fileName,
        String sampleId,
        String batchId,
        int extractionPhase,
        String documentType,
        Map<String, String> fields,
        Map<String, Object> additionalFields,
        Instant createdAt,
        Instant updatedAt
) {

    public CoaRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        additionalFields = additionalFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }

    public String field(String columnName) {
        return fields.get(columnName);
    }
}
