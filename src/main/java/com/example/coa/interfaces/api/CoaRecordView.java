package com.example.coa.interfaces.api;

import com.example.coa.domain.model.CoaRecord;
import com.example.coa.domain.schema.DefaultColumnSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat JSON view of a stored record, keyed the way the export reads rows back.
 * Null values are left out.
 */
final class CoaRecordView {

    private CoaRecordView() {
    }

    static Map<String, Object> flatten(CoaRecord record) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", record.id());
        view.put("file", record.fileName());
        view.put("sample_id", record.sampleId());
        view.put("batch_id", record.batchId());
        view.put("extraction_phase", record.extractionPhase());
        view.put("document_type", record.documentType());
        view.put(DefaultColumnSchema.SAMPLE_COLUMN, record.sampleId());
        view.put(DefaultColumnSchema.BATCH_COLUMN, record.batchId());
        view.putAll(record.fields());
        record.additionalFields().forEach(view::putIfAbsent);
        view.put("createdAt", record.createdAt());
        view.values().removeIf(value -> value == null);
        return view;
    }
}
