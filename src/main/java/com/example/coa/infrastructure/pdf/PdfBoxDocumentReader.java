package com.example.coa.infrastructure.pdf;

import com.example.coa.domain.exception.DocumentNotFoundException;
import com.example.coa.domain.model.ParsedDocument;
import com.example.coa.domain.model.ParsedTable;
import com.example.coa.infrastructure.exception.DocumentUnreadableException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox front-end that turns a COA file into running text plus the tables recovered from token positions.
 */
@Component
public class PdfBoxDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentReader.class);

	/**
	 * @param pdf      document on local disk
	 * @param fileName logical name used in logs and in the result
	 * @return text and tables of every page
	 * @throws DocumentNotFoundException    when the path does not exist
	 * @throws DocumentUnreadableException  when PDFBox cannot open or strip the file
	 */
    public ParsedDocument read(Path pdf, String fileName) {
        if (pdf == null || !Files.exists(pdf)) {
            throw new DocumentNotFoundException(pdf == null ? "<null>" : pdf.toAbsolutePath().toString());
        }
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            String text = extractText(document);
            List<ParsedTable> tables = extractTables(document);
            log.debug("Read {}: {} pages, {} tables", fileName, document.getNumberOfPages(), tables.size());
            return new ParsedDocument(fileName, document.getNumberOfPages(), text, tables);
        } catch (IOException e) {
            throw new DocumentUnreadableException("Unable to read the PDF " + fileName, e);
        }
    }

    private String extractText(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setLineSeparator("\n");
        stripper.setParagraphEnd("\n");
        return stripper.getText(document).strip();
    }

    private List<ParsedTable> extractTables(PDDocument document) throws IOException {
        List<ParsedTable> tables = new ArrayList<>();
        for (int page = 1; page <= document.getNumberOfPages(); page++) {
            PositionalLineStripper stripper = new PositionalLineStripper();
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            stripper.getText(document);
            tables.addAll(TableAssembler.assemble(page, stripper.getLines()));
        }
        return tables;
    }
}
