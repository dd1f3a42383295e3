package com.example.coa.application.extraction;

import com.example.coa.domain.exception.InvalidExtractionPhaseException;
import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ReservedKey;
import com.example.coa.domain.schema.ColumnSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts between the flat key/value form used on the wire and {@link ExtractedRecord}.
 * Reserved keys become typed attributes, known and targeted columns become fields, and every other key is kept
 * in {@code additionalFields}. Columns flagged as ignored never become fields. The transport keys {@code file} and {@code phase} are dropped.
 */
@Component
public class ExtractionResultMapper {

    private static final Logger log = LoggerFactory.getLogger(ExtractionResultMapper.class);

    static final Set<String> TRANSPORT_KEYS = Set.of("file", "phase");

    private final ColumnSchema schema;

    public ExtractionResultMapper(ColumnSchema schema) {
        this.schema = schema;
    }

    public ExtractedRecord fromFlatResult(Map<String, ?> flat, ExtractionPhase requestedPhase, Collection<String> targets) {
        String sampleId = null;
        String batchId = null;
        ExtractionPhase phase = requestedPhase;
        DocumentType documentType = DocumentType.GENERIC;
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, Object> additionalFields = new LinkedHashMap<>();

        for (Map.Entry<String, ?> entry : flat.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            Optional<ReservedKey> reserved = ReservedKey.fromKey(key);
            if (reserved.isPresent()) {
                switch (reserved.get()) {
                    case SAMPLE_ID -> sampleId = asText(value);
                    case BATCH_ID -> batchId = asText(value);
                    case EXTRACTION_PHASE -> phase = parsePhase(value, requestedPhase);
                    case DOCUMENT_TYPE -> documentType = DocumentType.fromDisplayName(asText(value));
                }
            } else if (TRANSPORT_KEYS.contains(key)) {
                log.trace("Transport key {} dropped", key);
            } else if (schema.isIgnoredColumn(key)) {
                log.debug("Ignored column {} kept as additional field", key);
                additionalFields.put(key, value);
            } else if (schema.isKnownColumn(key) || targets.contains(key)) {
                fields.put(key, asText(value));
            } else {
                additionalFields.put(key, value);
            }
        }
        return new ExtractedRecord(sampleId, batchId, phase, documentType, fields, additionalFields);
    }

	/**
	 * Flat view of an extraction as reported back to the uploader.
	 */
    public Map<String, Object> toFlatResult(ExtractedRecord record) {
        Map<String, Object> flat = new LinkedHashMap<>();
        if (record.sampleId() != null) {
            flat.put(ReservedKey.SAMPLE_ID.key(), record.sampleId());
        }
        if (record.batchId() != null) {
            flat.put(ReservedKey.BATCH_ID.key(), record.batchId());
        }
        flat.put(ReservedKey.EXTRACTION_PHASE.key(), record.extractionPhase().number());
        if (record.documentType().displayName() != null) {
            flat.put(ReservedKey.DOCUMENT_TYPE.key(), record.documentType().displayName());
        }
        flat.putAll(record.fields());
        record.additionalFields().forEach(flat::putIfAbsent);
        return flat;
    }

    private static ExtractionPhase parsePhase(Object value, ExtractionPhase fallback) {
        if (value instanceof Number number) {
            try {
                return ExtractionPhase.fromNumber(number.intValue());
            } catch (InvalidExtractionPhaseException ex) {
                log.warn("Ignoring unknown extraction phase {} reported by parser", value);
                return fallback;
            }
        }
        String text = asText(value);
        if (text == null || text.isBlank()) {
            return fallback;
        }
        try {
            return ExtractionPhase.parse(text);
        } catch (InvalidExtractionPhaseException ex) {
            log.warn("Ignoring unknown extraction phase {} reported by parser", value);
            return fallback;
        }
    }

    private static String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
