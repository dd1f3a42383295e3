package com.example.coa.infrastructure.excel;

import com.example.coa.infrastructure.config.CoaProperties;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExcelReferenceHeaderReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsHeaderRowOfDatabaseSheetIncludingBlanks() throws IOException {
        Path workbook = tempDir.resolve("COA database.xlsx");
        writeWorkbook(workbook);

        ExcelReferenceHeaderReader reader = new ExcelReferenceHeaderReader(new CoaProperties());

        assertThat(reader.readHeaders(workbook, 2)).hasValueSatisfying(headers ->
                assertThat(headers).containsExactly("Sample #", "", "Batch", "AV", "AV"));
    }

    @Test
    void configuredPathIsUsed() throws IOException {
        Path workbook = tempDir.resolve("reference.xlsx");
        writeWorkbook(workbook);
        CoaProperties properties = new CoaProperties();
        properties.getReferenceHeaders().setPath(workbook);

        assertThat(new ExcelReferenceHeaderReader(properties).readHeaders()).isPresent();
    }

    @Test
    void missingOrUnreadableWorkbookYieldsEmpty() throws IOException {
        ExcelReferenceHeaderReader reader = new ExcelReferenceHeaderReader(new CoaProperties());
        Path garbage = Files.writeString(tempDir.resolve("broken.xlsx"), "not a workbook");

        assertThat(reader.readHeaders()).isEmpty();
        assertThat(reader.readHeaders(tempDir.resolve("absent.xlsx"), 2)).isEmpty();
        assertThat(reader.readHeaders(garbage, 2)).isEmpty();
    }

    private static void writeWorkbook(Path target) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet notes = workbook.createSheet("Notes");
            notes.createRow(0).createCell(0).setCellValue("Read me");

            Sheet sheet = workbook.createSheet("COA Database");
            sheet.createRow(0).createCell(0).setCellValue("COA database export");
            sheet.createRow(1).createCell(0).setCellValue("Updated weekly");
            Row header = sheet.createRow(2);
            header.createCell(0).setCellValue("Sample #");
            header.createCell(2).setCellValue("Batch");
            header.createCell(3).setCellValue("AV");
            header.createCell(4).setCellValue("AV");
            Row data = sheet.createRow(3);
            data.createCell(0).setCellValue("M20253004");
            data.createCell(2).setCellValue("BA001734");
            data.createCell(3).setCellValue(19.3);

            try (OutputStream out = Files.newOutputStream(target)) {
                workbook.write(out);
            }
        }
    }
}
