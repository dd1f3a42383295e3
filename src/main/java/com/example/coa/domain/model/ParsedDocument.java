package com.example.coa.domain.model;

import java.util.List;

/**
 * Output of the PDF front-end: the running text plus every table found on every page.
 */
public record ParsedDocument(
        String fileName,
        int pageCount,
        String text,
        List<ParsedTable> tables
) {

    public ParsedDocument {
        text = text == null ? "" : text;
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
}
