package com.example.coa.application.service;

import com.example.coa.domain.model.ColumnDefinition;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.schema.ColumnSchema;
import com.example.coa.infrastructure.excel.ExcelReferenceHeaderReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Answers which columns exist and which ones an extraction run or an export uses.
 * <p>
 * Phase 1 runs and exports follow the reference header workbook when one is configured, so the export reproduces
 * its header row exactly. The header sequence is resolved once and cached for the lifetime of the process.
 */
@Service
public class ColumnCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ColumnCatalogService.class);

    private final ColumnSchema schema;
    private final ExcelReferenceHeaderReader referenceHeaderReader;
    private volatile List<String> referenceHeaders;

    public ColumnCatalogService(ColumnSchema schema, ExcelReferenceHeaderReader referenceHeaderReader) {
        this.schema = schema;
        this.referenceHeaderReader = referenceHeaderReader;
    }

    public List<ColumnDefinition> listColumns() {
        return schema.listColumns();
    }

    public List<ColumnDefinition> listColumns(ExtractionPhase phase) {
        return schema.listColumns(phase);
    }

    public Optional<ColumnDefinition> resolveDefinition(String name) {
        return schema.resolveDefinition(name);
    }

	/**
	 * Exact export header sequence: blanks and duplicates of the workbook are preserved.
	 * Falls back to the built-in phase 1 column names when the workbook is missing or unreadable.
	 */
    public List<String> referenceHeaders() {
        List<String> cached = referenceHeaders;
        if (cached == null) {
            synchronized (this) {
                cached = referenceHeaders;
                if (cached == null) {
                    cached = referenceHeaderReader.readHeaders()
                            .filter(headers -> !headers.isEmpty())
                            .map(List::copyOf)
                            .orElseGet(() -> {
                                log.info("Using built-in phase 1 columns as reference headers");
                                return schema.columnNames(ExtractionPhase.PHASE_1);
                            });
                    referenceHeaders = cached;
                }
            }
        }
        return cached;
    }

	/**
	 * Column names an extraction run of the given phase may emit. Reference headers naming an ignored column are
	 * left out.
	 */
    public List<String> extractionTargets(ExtractionPhase phase) {
        if (phase != ExtractionPhase.PHASE_1) {
            return schema.columnNames(phase);
        }
        return referenceHeaders().stream()
                .filter(header -> !schema.isIgnoredColumn(header))
                .toList();
    }
}
