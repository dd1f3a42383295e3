package com.example.coa.application.extraction;

import com.example.coa.domain.model.ColumnDefinition;
import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParameterCategory;
import com.example.coa.domain.schema.ColumnSchema;
import com.example.coa.domain.schema.DefaultColumnSchema;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ExtractionResultMapperTest {

    private final ExtractionResultMapper mapper = new ExtractionResultMapper(DefaultColumnSchema.create());

    @Test
    void reservedKeysBecomeTypedAttributes() {
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("file", "/tmp/upload.pdf");
        flat.put("phase", 2);
        flat.put("sample_id", "M20243602");
        flat.put("batch_id", "BA001734");
        flat.put("extraction_phase", 2);
        flat.put("document_type", "Spectral Service AG");
        flat.put("PC", "25.18");
        flat.put("Hydrolysis note", "see remarks");

        ExtractedRecord record = mapper.fromFlatResult(flat, ExtractionPhase.PHASE_1, List.of("PC"));

        assertThat(record.sampleId()).isEqualTo("M20243602");
        assertThat(record.batchId()).isEqualTo("BA001734");
        assertThat(record.extractionPhase()).isEqualTo(ExtractionPhase.PHASE_2);
        assertThat(record.documentType()).isEqualTo(DocumentType.SPECTRAL_SERVICE);
        assertThat(record.fields()).containsExactly(entry("PC", "25.18"));
        assertThat(record.additionalFields()).containsExactly(entry("Hydrolysis note", "see remarks"));
    }

    @Test
    void targetedColumnsOutsideTheSchemaAreFields() {
        ExtractedRecord record = mapper.fromFlatResult(Map.of("Customer limit", 4.5),
                ExtractionPhase.PHASE_1, List.of("Customer limit"));

        assertThat(record.fields()).containsExactly(entry("Customer limit", "4.5"));
    }

    @Test
    void ignoredColumnsNeverBecomeFields() {
        ColumnSchema schema = ColumnSchema.builder()
                .add(ColumnDefinition.of("AV", "Nofalab or TLR", ParameterCategory.CHEMICAL, ExtractionPhase.PHASE_1))
                .add(new ColumnDefinition("Legacy", null, ParameterCategory.CHEMICAL, ExtractionPhase.PHASE_1, true,
                        null, null, null, null))
                .build();
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("AV", "19.3");
        flat.put("Legacy", "x");

        ExtractedRecord record = new ExtractionResultMapper(schema)
                .fromFlatResult(flat, ExtractionPhase.PHASE_1, List.of("AV", "Legacy"));

        assertThat(record.fields()).containsExactly(entry("AV", "19.3"));
        assertThat(record.additionalFields()).containsExactly(entry("Legacy", "x"));
    }

    @Test
    void unknownPhaseFallsBackToRequestedPhase() {
        ExtractedRecord record = mapper.fromFlatResult(Map.of("extraction_phase", "7"), ExtractionPhase.PHASE_2, List.of());

        assertThat(record.extractionPhase()).isEqualTo(ExtractionPhase.PHASE_2);
        assertThat(record.documentType()).isEqualTo(DocumentType.GENERIC);
    }

    @Test
    void flatResultListsReservedKeysFirst() {
        ExtractedRecord record = new ExtractedRecord("M20243602", null, ExtractionPhase.PHASE_1,
                DocumentType.SPECTRAL_SERVICE, Map.of("PC", "25.18"), Map.of("PC", "ignored", "Extra", "1"));

        Map<String, Object> flat = mapper.toFlatResult(record);

        assertThat(flat).containsExactly(
                entry("sample_id", "M20243602"),
                entry("extraction_phase", 1),
                entry("document_type", "Spectral Service AG"),
                entry("PC", "25.18"),
                entry("Extra", "1"));
    }
}
