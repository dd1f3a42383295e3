package com.example.coa.application.extraction;

import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParsedTable;
import com.example.coa.domain.schema.ColumnSchema;
import com.example.coa.domain.schema.DefaultColumnSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

@ExtendWith(OutputCaptureExtension.class)
class TableValueExtractorTest {

    private final ColumnSchema schema = DefaultColumnSchema.create();
    private final TableValueExtractor extractor = new TableValueExtractor(new TableLayoutClassifier());

    @Test
    void spectralPackedCellIsPairedByPosition() {
        ParsedTable table = new ParsedTable(1, List.of(
                List.of("Analyte", "Weight-%"),
                List.of("PC", "25.18\n0.10\n1.05\n21.69\n10.32(approx)\n3.50"),
                List.of("1-LPC", ""),
                List.of("2-LPC", ""),
                List.of("PI", ""),
                List.of("PE", ""),
                List.of("PA", ""),
                List.of("Sum", "67.41")));
        ParameterLabelMatcher matcher = ParameterLabelMatcher.forTargets(schema,
                schema.columnNames(ExtractionPhase.PHASE_1));

        TableExtraction extraction = extractor.extract(List.of(table), DocumentType.SPECTRAL_SERVICE, matcher);

        assertThat(extraction.fields()).contains(
                entry("PC", "25.18"),
                entry("PE", "10.32"),
                entry("PI", "21.69"),
                entry("PA", "3.50"),
                entry("PL", "67.41"),
                entry("LPC", "1.15"));
        assertThat(extraction.unmatched()).isEmpty();
    }

    @Test
    void wellFormedRowsAreCleanedAndUnknownLabelsKept() {
        ParsedTable table = new ParsedTable(1, List.of(
                List.of("Parameter", "Result", "Unit"),
                List.of("Acid value", "19,3", "mg KOH/g"),
                List.of("Lead (Pb)", "< 0,02", "mg/kg"),
                List.of("Colour", "yellow", ""),
                List.of("", "12", "")));
        ParameterLabelMatcher matcher = ParameterLabelMatcher.forTargets(schema, List.of("AV", "Lead"));

        TableExtraction extraction = extractor.extract(List.of(table), DocumentType.GENERIC, matcher);

        assertThat(extraction.fields()).containsExactly(entry("AV", "19.3"), entry("Lead", "0.02"));
        assertThat(extraction.unmatched()).containsExactly(entry("Colour", "yellow"));
    }

    @Test
    void firstTableReportingAColumnWins(CapturedOutput output) {
        ParsedTable first = new ParsedTable(1, List.of(List.of("Parameter", "Result"), List.of("AV", "19,3")));
        ParsedTable second = new ParsedTable(2, List.of(List.of("Parameter", "Result"), List.of("AV", "21,0")));
        ParameterLabelMatcher matcher = ParameterLabelMatcher.forTargets(schema, List.of("AV"));

        TableExtraction extraction = extractor.extract(List.of(first, second), DocumentType.GENERIC, matcher);

        assertThat(extraction.fields()).containsExactly(entry("AV", "19.3"));
        assertThat(output).contains("Keeping first value '19.3' for AV, discarding later value '21.0'");
    }

    @Test
    void lpcFractionsAreReportedWhenLpcIsNotTargeted() {
        ParsedTable table = new ParsedTable(1, List.of(
                List.of("Component", "Weight-%"),
                List.of("1-LPC", "0.10"),
                List.of("2-LPC", "1.05"),
                List.of("PC", "25.18")));
        ParameterLabelMatcher matcher = ParameterLabelMatcher.forTargets(schema, List.of("PC"));

        TableExtraction extraction = extractor.extract(List.of(table), DocumentType.SPECTRAL_SERVICE, matcher);

        assertThat(extraction.fields()).containsExactly(entry("PC", "25.18"));
        assertThat(extraction.unmatched()).containsOnly(entry("1-LPC", "0.10"), entry("2-LPC", "1.05"));
    }

    @Test
    void reportedLpcBeatsDerivedValue() {
        ParsedTable table = new ParsedTable(1, List.of(
                List.of("Component", "Weight-%"),
                List.of("LPC", "2.00"),
                List.of("1-LPC", "0.10"),
                List.of("2-LPC", "1.05")));
        ParameterLabelMatcher matcher = ParameterLabelMatcher.forTargets(schema, List.of("LPC"));

        TableExtraction extraction = extractor.extract(List.of(table), DocumentType.SPECTRAL_SERVICE, matcher);

        assertThat(extraction.fields()).containsExactly(entry("LPC", "2.00"));
    }
}
