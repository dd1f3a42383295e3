package com.example.coa.application.service;

import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.SampleIdentifiers;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierResolverTest {

    private final IdentifierResolver resolver = new IdentifierResolver();

    @Test
    void sampleIdSpellingsNormalizeToTheSameValue() {
        for (String spelling : List.of("M20243602", "M 20243602", "m20243602", "m 20243602", "20243602", " M20243602 ")) {
            assertThat(resolver.normalizeSampleId(spelling)).as(spelling).isEqualTo("20243602");
        }
    }

    @Test
    void normalizationIsIdempotent() {
        String once = resolver.normalizeSampleId("M 20243602");

        assertThat(resolver.normalizeSampleId(once)).isEqualTo(once);
        assertThat(resolver.normalizeSampleId("Mango")).isEqualTo("Mango");
        assertThat(resolver.normalizeSampleId("MX1")).isEqualTo("MX1");
        assertThat(resolver.normalizeSampleId("M-2024")).isEqualTo("M-2024");
    }

    @Test
    void emptyIdentifiersNormalizeToNull() {
        assertThat(resolver.normalizeSampleId(null)).isNull();
        assertThat(resolver.normalizeSampleId("  ")).isNull();
        assertThat(resolver.normalizeSampleId("M")).isNull();
        assertThat(resolver.normalizeBatchId(" ")).isNull();
        assertThat(resolver.normalizeBatchId(" BA001734 ")).isEqualTo("BA001734");
    }

    @Test
    void filenameExtractionIgnoresTheLabSuffix() {
        SampleIdentifiers expected = new SampleIdentifiers("M20253004", "BA001734");

        assertThat(resolver.extractFromFilename("BA001734 - M20253004 - Ali.pdf")).isEqualTo(expected);
        assertThat(resolver.extractFromFilename("BA001734 - M20253004 - Nofalab.pdf")).isEqualTo(expected);
        assertThat(resolver.extractFromFilename("BA001682 - M20251009 - IFP.pdf"))
                .isEqualTo(new SampleIdentifiers("M20251009", "BA001682"));
    }

    @Test
    void filenameWithoutIdentifiersYieldsNothing() {
        assertThat(resolver.extractFromFilename("report.pdf")).isEqualTo(SampleIdentifiers.empty());
        assertThat(resolver.extractFromFilename("M 20253004 only.pdf").sampleId()).isEqualTo("M20253004");
        assertThat(resolver.extractFromFilename(null)).isEqualTo(SampleIdentifiers.empty());
    }

    @Test
    void textLookupPrefersSampleDescriptionLine() {
        String text = "Order M11111111\nSample description: Lecithin M 22222222\nSample No: M33333333\nLot BA000042";

        assertThat(resolver.findInText(text)).isEqualTo(new SampleIdentifiers("M22222222", "BA000042"));
        assertThat(resolver.findInText("Sample No: m44444444").sampleId()).isEqualTo("m44444444");
    }

    @Test
    void resolveFillsOnlyMissingIdentifiers() {
        ExtractedRecord partial = record("M20240001", null);

        ExtractedRecord resolved = resolver.resolve(partial, "BA001734 - M20253004 - Ali.pdf");

        assertThat(resolved.sampleId()).isEqualTo("M20240001");
        assertThat(resolved.batchId()).isEqualTo("BA001734");
    }

    @Test
    void resolveReturnsSameInstanceWhenNothingChanges() {
        ExtractedRecord complete = record("M20240001", "BA000001");
        ExtractedRecord empty = record(null, null);

        assertThat(resolver.resolve(complete, "BA001734 - M20253004.pdf")).isSameAs(complete);
        assertThat(resolver.resolve(empty, "report.pdf")).isSameAs(empty);
    }

    private static ExtractedRecord record(String sampleId, String batchId) {
        return new ExtractedRecord(sampleId, batchId, ExtractionPhase.PHASE_1, DocumentType.GENERIC,
                Map.of("AV", "19.3"), Map.of());
    }
}
