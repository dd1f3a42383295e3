package com.example.coa.application.extraction;

import com.example.coa.application.service.IdentifierResolver;
import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParsedDocument;
import com.example.coa.domain.model.ParsedTable;
import com.example.coa.domain.schema.ColumnSchema;
import com.example.coa.domain.schema.DefaultColumnSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class CoaDocumentExtractorTest {

    private final ColumnSchema schema = DefaultColumnSchema.create();
    private final CoaDocumentExtractor extractor = new CoaDocumentExtractor(
            schema,
            new TableValueExtractor(new TableLayoutClassifier()),
            new TextParameterExtractor(),
            new IdentifierResolver());

    @Test
    void tableValuesWinOverTextValues() {
        String text = String.join("\n",
                "Nofalab certificate",
                "Sample No: M20253004",
                "Batch BA001734",
                "Acid value 21,0 mg KOH/g",
                "Peroxide value 1,2 meq O2/kg");
        ParsedTable table = new ParsedTable(1, List.of(
                List.of("Parameter", "Result"),
                List.of("Acid value", "19,3")));

        ExtractedRecord record = extractor.extract(new ParsedDocument("a.pdf", 1, text, List.of(table)),
                List.of("AV", "POV"), ExtractionPhase.PHASE_1);

        assertThat(record.fields()).containsExactly(entry("AV", "19.3"), entry("POV", "1.2"));
        assertThat(record.sampleId()).isEqualTo("M20253004");
        assertThat(record.batchId()).isEqualTo("BA001734");
        assertThat(record.documentType()).isEqualTo(DocumentType.GENERIC);
        assertThat(record.extractionPhase()).isEqualTo(ExtractionPhase.PHASE_1);
    }

    @Test
    void spectralReportIsDetectedAndUnmatchedRowsKept() {
        String text = "Spectral Service AG\nPhospholipid analysis\nSample description: M 20243602";
        ParsedTable table = new ParsedTable(1, List.of(
                List.of("Analyte", "Weight-%"),
                List.of("PC", "25.18"),
                List.of("Glycerophosphocholine", "0.40")));

        ExtractedRecord record = extractor.extract(new ParsedDocument("b.pdf", 1, text, List.of(table)),
                schema.columnNames(ExtractionPhase.PHASE_1), ExtractionPhase.PHASE_1);

        assertThat(record.documentType()).isEqualTo(DocumentType.SPECTRAL_SERVICE);
        assertThat(record.fields()).containsEntry("PC", "25.18");
        assertThat(record.additionalFields()).containsEntry("Glycerophosphocholine", "0.40");
        assertThat(record.sampleId()).isEqualTo("M20243602");
        assertThat(record.batchId()).isNull();
    }

    @Test
    void documentWithoutResultsYieldsEmptyRecord() {
        ExtractedRecord record = extractor.extract(new ParsedDocument("c.pdf", 1, "", List.of()),
                List.of("AV"), ExtractionPhase.PHASE_2);

        assertThat(record.fields()).isEmpty();
        assertThat(record.additionalFields()).isEmpty();
        assertThat(record.sampleId()).isNull();
        assertThat(record.extractionPhase()).isEqualTo(ExtractionPhase.PHASE_2);
    }
}
