package com.example.coa.domain.model;

/**
 * Kind of measurement a COA column reports.
 */
public enum ParameterCategory {
    IDENTIFIER("Identifier"),
    CHEMICAL("Chemical"),
    MICROBIOLOGY("Microbiology"),
    CONTAMINANT("Contaminant"),
    PHOSPHOLIPID("PL"),
    GMO("GMO"),
    NOT_APPLICABLE("N.a.");

    private final String displayName;

    ParameterCategory(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return label used by the COA database workbook
     */
    public String displayName() {
        return displayName;
    }
}
