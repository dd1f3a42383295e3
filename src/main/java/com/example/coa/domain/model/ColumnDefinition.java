package com.example.coa.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one canonical COA parameter column.
 *
 * @param name        canonical column name, unique within a schema
 * @param laboratory  laboratory authoritative for the value (free text, e.g. "Spectral Service")
 * @param category    measurement category
 * @param phase       extraction phase the column belongs to
 * @param ignored     ignored columns never show up in listings or extraction output
 * @param fullName    optional long name (e.g. "Phosphatidylcholine" for PC)
 * @param unit        optional unit of measure
 * @param definition  optional description of the measurement
 * @param aliases     alternative row labels labs use for this parameter
 */
public record ColumnDefinition(
        String name,
        String laboratory,
        ParameterCategory category,
        ExtractionPhase phase,
        boolean ignored,
        String fullName,
        String unit,
        String definition,
        List<String> aliases
) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(phase, "phase");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

	/**
	 * Shorthand for columns without descriptive metadata.
	 */
    public static ColumnDefinition of(String name, String laboratory, ParameterCategory category, ExtractionPhase phase) {
        return new ColumnDefinition(name, laboratory, category, phase, false, null, null, null, List.of());
    }

    public boolean belongsTo(ExtractionPhase candidate) {
        return phase == candidate;
    }
}
