package com.example.coa.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw table recovered from a document page: ordered rows of ordered cell text.
 * Cells may contain line breaks when the source exporter packed several values together.
 */
public record ParsedTable(int pageNumber, List<List<String>> rows) {

    public ParsedTable {
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }

	/**
	 * Safe cell accessor.
	 *
	 * @return cell text, or an empty string for missing cells
	 */
    public String cell(int row, int column) {
        if (row < 0 || row >= rows.size()) {
            return "";
        }
        List<String> cells = rows.get(row);
        if (column < 0 || column >= cells.size()) {
            return "";
        }
        String value = cells.get(column);
        return value == null ? "" : value;
    }
}
