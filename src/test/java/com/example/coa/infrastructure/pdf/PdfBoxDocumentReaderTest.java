package com.example.coa.infrastructure.pdf;

import com.example.coa.application.extraction.CoaDocumentExtractor;
import com.example.coa.application.extraction.TableLayoutClassifier;
import com.example.coa.application.extraction.TableValueExtractor;
import com.example.coa.application.extraction.TextParameterExtractor;
import com.example.coa.application.service.IdentifierResolver;
import com.example.coa.domain.exception.DocumentNotFoundException;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParsedDocument;
import com.example.coa.domain.model.ParsedTable;
import com.example.coa.domain.schema.DefaultColumnSchema;
import com.example.coa.infrastructure.exception.DocumentUnreadableException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Reads small generated documents through PDFBox.
 */
class PdfBoxDocumentReaderTest {

    @TempDir
    Path tempDir;

    private final PdfBoxDocumentReader reader = new PdfBoxDocumentReader();

	/**
	 * Running text is kept and the analyte grid comes back as a table, packed values included.
	 */
    @Test
    void readsTextAndTables() throws IOException {
        Path pdf = tempDir.resolve("spectral.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                write(content, font, 50, 750, "Certificate of Analysis");
                write(content, font, 50, 700, "Analyte");
                write(content, font, 200, 700, "Weight-%");
                write(content, font, 50, 688, "PC");
                write(content, font, 200, 688, "25.18");
                write(content, font, 50, 676, "LPC");
                write(content, font, 200, 676, "0.10");
                write(content, font, 200, 664, "1.05");
            }
            document.save(pdf.toFile());
        }

        ParsedDocument parsed = reader.read(pdf, "spectral.pdf");

        assertThat(parsed.fileName()).isEqualTo("spectral.pdf");
        assertThat(parsed.pageCount()).isEqualTo(1);
        assertThat(parsed.text()).contains("Certificate of Analysis").contains("25.18");
        assertThat(parsed.tables()).hasSize(1);
        ParsedTable table = parsed.tables().get(0);
        assertThat(table.rows()).containsExactly(
                List.of("Analyte", "Weight-%"),
                List.of("PC", "25.18"),
                List.of("LPC", "0.10\n1.05"));
    }

	/**
	 * A two-part letterhead just above the results must not take over the table columns.
	 */
    @Test
    void letterheadDoesNotHideTheResultsTable() throws IOException {
        Path pdf = tempDir.resolve("letterhead.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                write(content, font, 50, 725, "Spectral Service AG");
                write(content, font, 400, 725, "Report 2025-0042");
                write(content, font, 50, 700, "Analyte");
                write(content, font, 200, 700, "Weight-%");
                write(content, font, 50, 688, "PC");
                write(content, font, 200, 688, "25.18");
                write(content, font, 50, 676, "PE");
                write(content, font, 200, 676, "10.32");
            }
            document.save(pdf.toFile());
        }

        ParsedDocument parsed = reader.read(pdf, "letterhead.pdf");

        assertThat(parsed.tables()).singleElement().satisfies(table -> assertThat(table.rows()).containsExactly(
                List.of("Analyte", "Weight-%"),
                List.of("PC", "25.18"),
                List.of("PE", "10.32")));

        CoaDocumentExtractor extractor = new CoaDocumentExtractor(DefaultColumnSchema.create(),
                new TableValueExtractor(new TableLayoutClassifier()), new TextParameterExtractor(),
                new IdentifierResolver());
        ExtractedRecord record = extractor.extract(parsed, List.of("PC", "PE"), ExtractionPhase.PHASE_1);
        assertThat(record.fields()).containsOnly(entry("PC", "25.18"), entry("PE", "10.32"));
    }

    @Test
    void missingFileIsReportedAsNotFound() {
        assertThrows(DocumentNotFoundException.class, () -> reader.read(tempDir.resolve("absent.pdf"), "absent.pdf"));
        assertThrows(DocumentNotFoundException.class, () -> reader.read(null, "none.pdf"));
    }

    @Test
    void garbageBytesAreUnreadable() throws IOException {
        Path broken = tempDir.resolve("broken.pdf");
        Files.writeString(broken, "this is not a pdf", StandardCharsets.UTF_8);

        DocumentUnreadableException thrown = assertThrows(DocumentUnreadableException.class,
                () -> reader.read(broken, "broken.pdf"));
        assertThat(thrown.errorCode()).isEqualTo("DOCUMENT_UNREADABLE");
        assertThat(thrown).hasMessageContaining("broken.pdf");
    }

    private static void write(PDPageContentStream content, PDType1Font font, float x, float y, String text)
            throws IOException {
        content.beginText();
        content.setFont(font, 10);
        content.newLineAtOffset(x, y);
        content.showText(text);
        content.endText();
    }
}
