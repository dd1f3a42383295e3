package com.example.coa.infrastructure.pdf;

import com.example.coa.application.extraction.CoaDocumentExtractor;
import com.example.coa.application.extraction.ExtractionBackend;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParsedDocument;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * In-process backend: PDFBox parsing followed by the table and text extraction pipeline.
 */
@Component
@ConditionalOnProperty(prefix = "coa.extraction", name = "backend", havingValue = "pdfbox", matchIfMissing = true)
public class PdfBoxExtractionBackend implements ExtractionBackend {

    private final PdfBoxDocumentReader documentReader;
    private final CoaDocumentExtractor documentExtractor;

    public PdfBoxExtractionBackend(PdfBoxDocumentReader documentReader, CoaDocumentExtractor documentExtractor) {
        this.documentReader = documentReader;
        this.documentExtractor = documentExtractor;
    }

    @Override
    public ExtractedRecord extract(Path pdf, String originalFileName, List<String> targetColumns, ExtractionPhase phase) {
        ParsedDocument document = documentReader.read(pdf, originalFileName);
        return documentExtractor.extract(document, targetColumns, phase);
    }
}
