package com.example.coa.application.extraction;

import com.example.coa.domain.model.TableLayout;

/**
 * Outcome of classifying one parsed table.
 *
 * @param layout        detected layout class
 * @param headerRow     row holding the value column header; data rows follow it
 * @param labelColumn   column holding the parameter labels
 * @param valueColumn   column holding the reported values
 * @param malformedRow  row of the cell packing several values, {@code -1} for well-formed tables
 */
public record TableClassification(TableLayout layout, int headerRow, int labelColumn, int valueColumn, int malformedRow) {

    public boolean isMalformed() {
        return layout == TableLayout.MALFORMED_MULTI_VALUE_CELL;
    }
}
