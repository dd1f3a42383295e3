package com.example.coa.application.extraction;

import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ParsedTable;
import com.example.coa.domain.model.TableLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates the label and value columns of a parsed table and decides whether the value column is
 * well formed or packs the values of several rows into a single cell.
 */
@Component
public class TableLayoutClassifier {

    private static final Logger log = LoggerFactory.getLogger(TableLayoutClassifier.class);

    static final int MIN_LINE_BREAKS = 2;
    static final int MIN_NUMERIC_LINES = 5;

    private static final Pattern NUMERIC_LINE = Pattern.compile("^\\s*(?:[<>≤≥]=?\\s*)?\\d+(?:[.,]\\d+)?");
    private static final List<String> LABEL_HEADERS = List.of("analyte", "component", "compound", "parameter");

	/**
	 * @param table        table recovered from a page
	 * @param documentType laboratory family detected for the document
	 * @return classification, or empty when the table has no recognizable value column
	 */
    public Optional<TableClassification> classify(ParsedTable table, DocumentType documentType) {
        if (table == null || table.rowCount() < 2) {
            return Optional.empty();
        }
        int[] valueHeader = locateValueColumn(table, documentType);
        if (valueHeader == null) {
            log.debug("Page {} table without value column skipped", table.pageNumber());
            return Optional.empty();
        }
        int headerRow = valueHeader[0];
        int valueColumn = valueHeader[1];
        int labelColumn = locateLabelColumn(table, valueColumn);

        for (int row = 0; row < table.rowCount(); row++) {
            String cell = table.cell(row, valueColumn);
            if (countLineBreaks(cell) >= MIN_LINE_BREAKS && numericLines(cell).size() >= MIN_NUMERIC_LINES) {
                log.debug("Page {} table classified as multi-value cell at row {}, column {}",
                        table.pageNumber(), row, valueColumn);
                return Optional.of(new TableClassification(
                        TableLayout.MALFORMED_MULTI_VALUE_CELL, headerRow, labelColumn, valueColumn, row));
            }
        }
        log.debug("Page {} table classified as well formed (label column {}, value column {})",
                table.pageNumber(), labelColumn, valueColumn);
        return Optional.of(new TableClassification(TableLayout.WELL_FORMED, headerRow, labelColumn, valueColumn, -1));
    }

	/**
	 * Splits a cell on line breaks and keeps the lines that start with a number, optionally after a comparator.
	 */
    public static List<String> numericLines(String cell) {
        List<String> lines = new ArrayList<>();
        if (cell == null || cell.isEmpty()) {
            return lines;
        }
        for (String line : cell.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && NUMERIC_LINE.matcher(trimmed).find()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private int[] locateValueColumn(ParsedTable table, DocumentType documentType) {
        for (int row = 0; row < table.rowCount(); row++) {
            List<String> cells = table.rows().get(row);
            for (int column = 0; column < cells.size(); column++) {
                String lower = table.cell(row, column).trim().toLowerCase(Locale.ROOT);
                if (documentType == DocumentType.SPECTRAL_SERVICE
                        ? lower.contains("weight-") && lower.contains("%")
                        : isResultHeader(lower)) {
                    return new int[]{row, column};
                }
            }
        }
        return null;
    }

    private static boolean isResultHeader(String lower) {
        return lower.startsWith("result")
                || lower.equals("value")
                || lower.startsWith("value ")
                || lower.contains("weight-%");
    }

    private int locateLabelColumn(ParsedTable table, int valueColumn) {
        for (int row = 0; row < table.rowCount(); row++) {
            List<String> cells = table.rows().get(row);
            for (int column = 0; column < cells.size(); column++) {
                if (column == valueColumn) {
                    continue;
                }
                String lower = table.cell(row, column).toLowerCase(Locale.ROOT);
                if (LABEL_HEADERS.stream().anyMatch(lower::contains)) {
                    return column;
                }
            }
        }
        return valueColumn == 0 ? 1 : 0;
    }

    private static int countLineBreaks(String cell) {
        int count = 0;
        for (int index = 0; index < cell.length(); index++) {
            if (cell.charAt(index) == '\n') {
                count++;
            }
        }
        return count;
    }
}
