package com.example.coa.domain.schema;

import com.example.coa.domain.model.ColumnDefinition;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParameterCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable, ordered registry of canonical COA columns.
 * Instances are assembled once through {@link Builder}; every accessor returns a read-only view.
 */
public final class ColumnSchema {

    private final List<ColumnDefinition> columns;
    private final Map<String, ColumnDefinition> columnsByName;

    private ColumnSchema(List<ColumnDefinition> columns) {
        this.columns = List.copyOf(columns);
        Map<String, ColumnDefinition> index = new LinkedHashMap<>();
        for (ColumnDefinition column : this.columns) {
            index.put(column.name(), column);
        }
        this.columnsByName = Collections.unmodifiableMap(index);
    }

    public static Builder builder() {
        return new Builder();
    }

	/**
	 * @return every active column in registry order
	 */
    public List<ColumnDefinition> listColumns() {
        return select(column -> true);
    }

	/**
	 * @param phase phase filter
	 * @return active columns belonging to the phase, in registry order
	 */
    public List<ColumnDefinition> listColumns(ExtractionPhase phase) {
        Objects.requireNonNull(phase, "phase");
        return select(column -> column.belongsTo(phase));
    }

    public List<String> columnNames(ExtractionPhase phase) {
        return listColumns(phase).stream().map(ColumnDefinition::name).toList();
    }

	/**
	 * Looks up a column by its exact canonical name. Ignored columns resolve as well.
	 */
    public Optional<ColumnDefinition> resolveDefinition(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columnsByName.get(name));
    }

    public boolean isKnownColumn(String name) {
        return name != null && columnsByName.containsKey(name);
    }

	/**
	 * @return {@code true} when the name resolves to a column flagged as ignored
	 */
    public boolean isIgnoredColumn(String name) {
        return resolveDefinition(name).map(ColumnDefinition::ignored).orElse(false);
    }

	/**
	 * @param laboratory fragment of the laboratory label, e.g. "Spectral"
	 * @return active columns whose laboratory label contains the fragment
	 */
    public List<ColumnDefinition> columnsByLaboratory(String laboratory) {
        if (laboratory == null || laboratory.isBlank()) {
            return List.of();
        }
        return select(column -> column.laboratory() != null && column.laboratory().contains(laboratory));
    }

    public List<ColumnDefinition> columnsByCategory(ParameterCategory category) {
        return select(column -> column.category() == category);
    }

    public List<ColumnDefinition> ignoredColumns() {
        return columns.stream().filter(ColumnDefinition::ignored).toList();
    }

    public int size() {
        return columns.size();
    }

    private List<ColumnDefinition> select(Predicate<ColumnDefinition> filter) {
        return columns.stream()
                .filter(column -> !column.ignored())
                .filter(filter)
                .toList();
    }

	/**
	 * Collects column definitions in insertion order and refuses duplicate names.
	 */
    public static final class Builder {

        private final List<ColumnDefinition> columns = new ArrayList<>();
        private final Map<String, ColumnDefinition> seen = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(ColumnDefinition column) {
            Objects.requireNonNull(column, "column");
            if (seen.putIfAbsent(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
            columns.add(column);
            return this;
        }

        public ColumnSchema build() {
            return new ColumnSchema(columns);
        }
    }
}
