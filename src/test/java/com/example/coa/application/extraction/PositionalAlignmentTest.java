package com.example.coa.application.extraction;

import com.example.coa.application.extraction.PositionalAlignment.Alignment;
import com.example.coa.application.extraction.PositionalAlignment.LabelValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PositionalAlignmentTest {

    @Test
    void pairsByIndexAndReportsUnmatchedLabels() {
        Alignment alignment = PositionalAlignment.pairByIndex(List.of("PC", "PE", "PI"), List.of("25.18", "10.32"));

        assertThat(alignment.pairs()).containsExactly(new LabelValue("PC", "25.18"), new LabelValue("PE", "10.32"));
        assertThat(alignment.unmatchedLabels()).containsExactly("PI");
        assertThat(alignment.surplusValues()).isEmpty();
    }

    @Test
    void reportsSurplusValues() {
        Alignment alignment = PositionalAlignment.pairByIndex(List.of("PC"), List.of("25.18", "0.10", "1.05"));

        assertThat(alignment.pairs()).hasSize(1);
        assertThat(alignment.unmatchedLabels()).isEmpty();
        assertThat(alignment.surplusValues()).containsExactly("0.10", "1.05");
    }
}
