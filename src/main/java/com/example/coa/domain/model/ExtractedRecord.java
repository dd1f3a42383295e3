package com.example.coa.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable extraction result for one document.
 *
 * @param sampleId          sample identifier found in the document, if any
 * @param batchId           batch identifier found in the document, if any
 * @param extractionPhase   phase the extraction targeted
 * @param documentType      detected laboratory document family
 * @param fields            canonical column name to extracted value, in extraction order
 * @param additionalFields  extracted keys that map to no known column
 */
public record ExtractedRecord(
        String sampleId,
        String batchId,
        ExtractionPhase extractionPhase,
        DocumentType documentType,
        Map<String, String> fields,
        Map<String, Object> additionalFields
) {

    public ExtractedRecord {
        Objects.requireNonNull(extractionPhase, "extractionPhase");
        documentType = documentType == null ? DocumentType.GENERIC : documentType;
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        additionalFields = additionalFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }

	/**
	 * Returns a copy carrying the given identifiers; every other attribute is kept.
	 */
    public ExtractedRecord withIdentifiers(String newSampleId, String newBatchId) {
        return new ExtractedRecord(newSampleId, newBatchId, extractionPhase, documentType, fields, additionalFields);
    }

    public String field(String columnName) {
        return fields.get(columnName);
    }
}
