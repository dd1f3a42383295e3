package com.example.coa.infrastructure.excel;

import com.example.coa.infrastructure.config.CoaProperties;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the export header row of the reference COA database workbook with Apache POI.
 * <p>
 * The sheet named like "Database" or "COA" is preferred, otherwise the first sheet is used. The header row sits
 * {@code header-row-offset} rows below the first used row. Every column of the used range is returned, blank
 * cells as empty strings, so order and duplicates match the workbook exactly.
 */
@Component
public class ExcelReferenceHeaderReader {

    private static final Logger log = LoggerFactory.getLogger(ExcelReferenceHeaderReader.class);

    private final CoaProperties properties;
    private final DataFormatter formatter = new DataFormatter();

    public ExcelReferenceHeaderReader(CoaProperties properties) {
        this.properties = properties;
    }

	/**
	 * Reads the workbook configured under {@code coa.reference-headers}.
	 *
	 * @return header sequence, empty when no workbook is configured or it cannot be read
	 */
    public Optional<List<String>> readHeaders() {
        CoaProperties.ReferenceHeaders settings = properties.getReferenceHeaders();
        if (settings.getPath() == null) {
            log.debug("No reference header workbook configured");
            return Optional.empty();
        }
        return readHeaders(settings.getPath(), settings.getHeaderRowOffset());
    }

    public Optional<List<String>> readHeaders(Path workbookPath, int headerRowOffset) {
        if (!Files.isRegularFile(workbookPath)) {
            log.warn("COA reference workbook not found at {}, using built-in headers", workbookPath);
            return Optional.empty();
        }
        try (Workbook workbook = WorkbookFactory.create(workbookPath.toFile(), null, true)) {
            Sheet sheet = preferredSheet(workbook);
            if (sheet == null || sheet.getPhysicalNumberOfRows() == 0) {
                log.warn("COA reference workbook {} has no used range, using built-in headers", workbookPath);
                return Optional.empty();
            }
            return Optional.of(headerRow(sheet, headerRowOffset));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read COA reference workbook at {}, using built-in headers", workbookPath, e);
            return Optional.empty();
        }
    }

    private Sheet preferredSheet(Workbook workbook) {
        for (int index = 0; index < workbook.getNumberOfSheets(); index++) {
            String name = workbook.getSheetName(index).toLowerCase(Locale.ROOT);
            if (name.contains("database") || name.contains("coa")) {
                return workbook.getSheetAt(index);
            }
        }
        return workbook.getNumberOfSheets() > 0 ? workbook.getSheetAt(0) : null;
    }

    private List<String> headerRow(Sheet sheet, int headerRowOffset) {
        int firstColumn = Integer.MAX_VALUE;
        int lastColumn = -1;
        for (Row row : sheet) {
            if (row.getFirstCellNum() >= 0) {
                firstColumn = Math.min(firstColumn, row.getFirstCellNum());
                lastColumn = Math.max(lastColumn, row.getLastCellNum() - 1);
            }
        }
        List<String> headers = new ArrayList<>();
        if (lastColumn < 0) {
            return headers;
        }
        Row header = sheet.getRow(sheet.getFirstRowNum() + headerRowOffset);
        for (int column = firstColumn; column <= lastColumn; column++) {
            Cell cell = header == null ? null : header.getCell(column);
            headers.add(cell == null ? "" : formatter.formatCellValue(cell));
        }
        log.info("Read {} reference headers from sheet '{}'", headers.size(), sheet.getSheetName());
        return headers;
    }
}
