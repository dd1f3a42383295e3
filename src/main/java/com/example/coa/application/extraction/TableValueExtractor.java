package com.example.coa.application.extraction;

import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ParsedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns classified tables into column values.
 * <p>
 * Well-formed tables are read row by row. For tables whose value column packs the values of several rows into
 * one cell, the expected labels and the packed values are paired by position. Sum and phosphorus rows keep
 * their own value cell in those tables and are read directly. LPC is derived from its 1-LPC and 2-LPC
 * fractions whenever they are reported.
 */
@Component
public class TableValueExtractor {

    private static final Logger log = LoggerFactory.getLogger(TableValueExtractor.class);

    static final String LPC = "LPC";
    static final String PHOSPHOLIPIDS = "PL";
    static final String PHOSPHORUS = "P";

    private final TableLayoutClassifier classifier;

    public TableValueExtractor(TableLayoutClassifier classifier) {
        this.classifier = classifier;
    }

	/**
	 * @param tables       tables of one document in page order
	 * @param documentType detected laboratory family
	 * @param matcher      matcher scoped to the run's target columns
	 * @return recovered values; the first table reporting a column wins
	 */
    public TableExtraction extract(List<ParsedTable> tables, DocumentType documentType, ParameterLabelMatcher matcher) {
        Accumulator accumulator = new Accumulator(documentType, matcher);
        for (ParsedTable table : tables) {
            classifier.classify(table, documentType).ifPresent(classification -> {
                if (classification.isMalformed()) {
                    extractMultiValueCell(table, classification, accumulator);
                } else {
                    extractRows(table, classification, accumulator);
                }
            });
        }
        accumulator.deriveLpc();
        return new TableExtraction(accumulator.fields, accumulator.unmatched);
    }

    private void extractRows(ParsedTable table, TableClassification classification, Accumulator accumulator) {
        for (int row = classification.headerRow() + 1; row < table.rowCount(); row++) {
            String label = table.cell(row, classification.labelColumn()).trim();
            String value = table.cell(row, classification.valueColumn()).trim();
            if (label.isEmpty() || value.isEmpty()) {
                continue;
            }
            accumulator.accept(label, value);
        }
    }

    private void extractMultiValueCell(ParsedTable table, TableClassification classification, Accumulator accumulator) {
        List<String> labels = new ArrayList<>();
        for (int row = classification.headerRow() + 1; row < table.rowCount(); row++) {
            String labelCell = table.cell(row, classification.labelColumn());
            for (String line : labelCell.split("\\r?\\n")) {
                String label = line.trim();
                if (label.isEmpty()) {
                    continue;
                }
                if (accumulator.specialTarget(label).isPresent()) {
                    if (row != classification.malformedRow()) {
                        String ownValue = table.cell(row, classification.valueColumn()).trim();
                        if (!ownValue.isEmpty()) {
                            accumulator.accept(label, ownValue);
                        }
                    }
                    continue;
                }
                labels.add(label);
            }
        }

        String packedCell = table.cell(classification.malformedRow(), classification.valueColumn());
        List<String> values = TableLayoutClassifier.numericLines(packedCell);
        PositionalAlignment.Alignment alignment = PositionalAlignment.pairByIndex(labels, values);
        for (PositionalAlignment.LabelValue pair : alignment.pairs()) {
            accumulator.accept(pair.label(), pair.value());
        }
        if (!alignment.unmatchedLabels().isEmpty()) {
            log.info("No value recovered for labels {} on page {}", alignment.unmatchedLabels(), table.pageNumber());
        }
        if (!alignment.surplusValues().isEmpty()) {
            log.info("Dropped {} surplus values {} on page {}", alignment.surplusValues().size(),
                    alignment.surplusValues(), table.pageNumber());
        }
    }

    private static final class Accumulator {
        private final DocumentType documentType;
        private final ParameterLabelMatcher matcher;
        private final Map<String, String> fields = new LinkedHashMap<>();
        private final Map<String, Object> unmatched = new LinkedHashMap<>();
        private String firstLpcFraction;
        private String secondLpcFraction;

        private Accumulator(DocumentType documentType, ParameterLabelMatcher matcher) {
            this.documentType = documentType;
            this.matcher = matcher;
        }

        void accept(String label, String rawValue) {
            String lower = label.toLowerCase(Locale.ROOT);
            if (lower.contains("1-lpc") || lower.contains("lysopc(16:0)")) {
                firstLpcFraction = keepFirst("1-LPC", firstLpcFraction, CoaValueCleaner.clean(rawValue, label));
                return;
            }
            if (lower.contains("2-lpc") || lower.contains("lysopc(18:")) {
                secondLpcFraction = keepFirst("2-LPC", secondLpcFraction, CoaValueCleaner.clean(rawValue, label));
                return;
            }
            Optional<String> column = specialTarget(label).or(() -> matcher.match(label));
            if (column.isPresent() && matcher.isTarget(column.get())) {
                String key = column.get();
                fields.put(key, keepFirst(key, fields.get(key), CoaValueCleaner.clean(rawValue, key)));
                return;
            }
            unmatched.put(label, keepFirst(label, (String) unmatched.get(label), CoaValueCleaner.clean(rawValue, label)));
        }

		/**
		 * The first value read for a key wins; a later differing value is reported and discarded.
		 */
        private static String keepFirst(String key, String current, String candidate) {
            if (current == null) {
                return candidate;
            }
            if (!current.equals(candidate)) {
                log.info("Keeping first value '{}' for {}, discarding later value '{}'", current, key, candidate);
            }
            return current;
        }

		/**
		 * Labels whose value is read from their own cell, even in multi-value tables.
		 */
        Optional<String> specialTarget(String label) {
            String lower = label.trim().toLowerCase(Locale.ROOT);
            if (lower.equals("p") || lower.equals("phosphorus")) {
                return Optional.of(PHOSPHORUS);
            }
            if (lower.equals("sum") || lower.equals("total")) {
                return Optional.of(PHOSPHOLIPIDS);
            }
            if (documentType == DocumentType.SPECTRAL_SERVICE && (lower.startsWith("sum ") || lower.contains("total"))) {
                return Optional.of(PHOSPHOLIPIDS);
            }
            return Optional.empty();
        }

        void deriveLpc() {
            if (!matcher.isTarget(LPC)) {
                if (firstLpcFraction != null) {
                    unmatched.putIfAbsent("1-LPC", firstLpcFraction);
                }
                if (secondLpcFraction != null) {
                    unmatched.putIfAbsent("2-LPC", secondLpcFraction);
                }
                return;
            }
            if (fields.containsKey(LPC)) {
                if (firstLpcFraction != null || secondLpcFraction != null) {
                    log.info("Reported LPC {} kept, fractions {} and {} not summed",
                            fields.get(LPC), firstLpcFraction, secondLpcFraction);
                }
                return;
            }
            List<String> fractions = new ArrayList<>();
            if (firstLpcFraction != null) {
                fractions.add(firstLpcFraction);
            }
            if (secondLpcFraction != null) {
                fractions.add(secondLpcFraction);
            }
            DerivedValues.sum(fractions).ifPresent(lpc -> {
                log.debug("LPC derived from fractions {} as {}", fractions, lpc);
                fields.put(LPC, lpc);
            });
        }
    }
}
