package com.example.coa.application.service;

import com.example.coa.application.exception.CsvExportValidationException;
import com.example.coa.domain.model.ReservedKey;
import com.example.coa.domain.schema.DefaultColumnSchema;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Turns selected COA rows into CSV content whose header line is exactly the reference header sequence.
 */
@Service
public class CsvExportService {

    private final ColumnCatalogService columnCatalog;

    public CsvExportService(ColumnCatalogService columnCatalog) {
        this.columnCatalog = columnCatalog;
    }

	/**
	 * Builds the CSV document for the given rows.
	 *
	 * @param rows flat rows keyed by column name, as listed by the records endpoint or edited by the client
	 * @return CSV content, lines separated by {@code \n}
	 * @throws CsvExportValidationException when no rows are supplied
	 */
    public String exportRows(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new CsvExportValidationException("No rows provided for export");
        }
        return buildCsv(columnCatalog.referenceHeaders(), rows);
    }

	/**
	 * Blank headers are kept as empty columns and always produce an empty field, so no column shifts.
	 */
    String buildCsv(List<String> headers, List<Map<String, Object>> rows) {
        StringJoiner document = new StringJoiner("\n");
        StringJoiner headerLine = new StringJoiner(",");
        headers.forEach(header -> headerLine.add(escape(header)));
        document.add(headerLine.toString());

        for (Map<String, Object> row : rows) {
            StringJoiner line = new StringJoiner(",");
            for (String header : headers) {
                line.add(header.isEmpty() ? "" : escape(valueFor(row, header)));
            }
            document.add(line.toString());
        }
        return document.toString();
    }

    private static Object valueFor(Map<String, Object> row, String header) {
        Object value = row.get(header);
        if (value != null) {
            return value;
        }
        if (DefaultColumnSchema.SAMPLE_COLUMN.equals(header)) {
            return row.get(ReservedKey.SAMPLE_ID.key());
        }
        if (DefaultColumnSchema.BATCH_COLUMN.equals(header)) {
            return row.get(ReservedKey.BATCH_ID.key());
        }
        return null;
    }

	/**
	 * Quotes values containing a comma, a quote, CR or LF and doubles embedded quotes.
	 */
    private static String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = String.valueOf(value);
        if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }
}
