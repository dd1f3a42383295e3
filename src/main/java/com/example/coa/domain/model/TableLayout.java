package com.example.coa.domain.model;

/**
 * Layout class of an extracted parameter table.
 * Some lab exporters concatenate all rows' values into the first row's cell, which makes
 * row-wise lookup impossible and requires positional matching instead.
 */
public enum TableLayout {
    WELL_FORMED,
    MALFORMED_MULTI_VALUE_CELL
}
