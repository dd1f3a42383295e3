package com.example.coa.application.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values recovered from the tables of one document.
 *
 * @param fields     target column name to cleaned value
 * @param unmatched  raw row label to cleaned value for rows no target column claimed
 */
public record TableExtraction(Map<String, String> fields, Map<String, Object> unmatched) {

    public TableExtraction {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        unmatched = Collections.unmodifiableMap(new LinkedHashMap<>(unmatched));
    }

    public static TableExtraction empty() {
        return new TableExtraction(Map.of(), Map.of());
    }
}
