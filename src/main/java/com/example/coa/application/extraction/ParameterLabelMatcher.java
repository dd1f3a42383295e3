package com.example.coa.application.extraction;

import com.example.coa.domain.model.ColumnDefinition;
import com.example.coa.domain.schema.ColumnSchema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a row label printed by a lab onto one of the columns an extraction run targets.
 * Tiers are tried in order: exact name (case-insensitive), alias, then substring where the label contains a
 * name or alias of at least {@value #MIN_SUBSTRING_LENGTH} characters. The longest substring candidate wins.
 */
public final class ParameterLabelMatcher {

    static final int MIN_SUBSTRING_LENGTH = 4;

    private final Set<String> targets;
    private final Map<String, String> exactNames;
    private final Map<String, String> aliases;

    private ParameterLabelMatcher(Set<String> targets, Map<String, String> exactNames, Map<String, String> aliases) {
        this.targets = Collections.unmodifiableSet(targets);
        this.exactNames = exactNames;
        this.aliases = aliases;
    }

	/**
	 * Builds a matcher for the given target columns. Blank targets and columns flagged as ignored are skipped; aliases come from the schema.
	 *
	 * @param schema  registry providing the alias lists
	 * @param targets column names the run may emit, e.g. the reference header sequence
	 */
    public static ParameterLabelMatcher forTargets(ColumnSchema schema, Collection<String> targets) {
        Set<String> active = new LinkedHashSet<>();
        Map<String, String> exact = new LinkedHashMap<>();
        Map<String, String> alias = new LinkedHashMap<>();
        for (String target : targets) {
            if (target == null || target.isBlank() || schema.isIgnoredColumn(target)) {
                continue;
            }
            active.add(target);
            exact.putIfAbsent(normalize(target), target);
        }
        for (String target : active) {
            schema.resolveDefinition(target)
                    .map(ColumnDefinition::aliases)
                    .ifPresent(list -> list.forEach(value -> alias.putIfAbsent(normalize(value), target)));
        }
        return new ParameterLabelMatcher(active, exact, alias);
    }

    public Optional<String> match(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(label);
        String exact = exactNames.get(normalized);
        if (exact != null) {
            return Optional.of(exact);
        }
        String aliased = aliases.get(normalized);
        if (aliased != null) {
            return Optional.of(aliased);
        }
        return matchBySubstring(normalized);
    }

    public boolean isTarget(String columnName) {
        return targets.contains(columnName);
    }

    public Set<String> targets() {
        return targets;
    }

    private Optional<String> matchBySubstring(String label) {
        String best = null;
        int bestLength = 0;
        for (Map<String, String> candidates : List.of(exactNames, aliases)) {
            for (Map.Entry<String, String> candidate : candidates.entrySet()) {
                String key = candidate.getKey();
                if (key.length() >= MIN_SUBSTRING_LENGTH && key.length() > bestLength && label.contains(key)) {
                    best = candidate.getValue();
                    bestLength = key.length();
                }
            }
        }
        return Optional.ofNullable(best);
    }

    static String normalize(String value) {
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
