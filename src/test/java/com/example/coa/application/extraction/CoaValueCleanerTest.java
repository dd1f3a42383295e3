package com.example.coa.application.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CoaValueCleanerTest {

    @Test
    void takesFirstNumberAndNormalizesDecimalComma() {
        assertThat(CoaValueCleaner.clean("19,3 mg KOH/g", "AI")).isEqualTo("19.3");
        assertThat(CoaValueCleaner.clean("  1.4 meq O2/kg ", "POV")).isEqualTo("1.4");
    }

    @Test
    void notDetectedBecomesNegative() {
        assertThat(CoaValueCleaner.clean("Not detected per 25 g", "Salmonella (in 25g)")).isEqualTo("negative");
        assertThat(CoaValueCleaner.clean("nd", "Lead")).isEqualTo("negative");
    }

    @Test
    void lessThanKeepsLimitUnlessTinyPercentage() {
        assertThat(CoaValueCleaner.clean("Less than 0,5 meq", "POV")).isEqualTo("0.5");
        assertThat(CoaValueCleaner.clean("Less than 0,01 %", "Moisture")).isEqualTo("0.00");
        assertThat(CoaValueCleaner.clean("0.005 %", "Moisture")).isEqualTo("0.00");
    }

    @Test
    void viscosityWithUnitIsConvertedToPascalSeconds() {
        assertThat(CoaValueCleaner.clean("4183 cP", "Viscosity at 25°C")).isEqualTo("4.183");
        assertThat(CoaValueCleaner.clean("4.2", "Viscosity at 25°C")).isEqualTo("4.2");
        assertThat(CoaValueCleaner.clean("4183 cP", "Viscosity at 40°C")).isEqualTo("4183");
    }

    @Test
    void textWithoutNumberIsKept() {
        assertThat(CoaValueCleaner.clean("Conforms", "Pesticides")).isEqualTo("Conforms");
        assertThat(CoaValueCleaner.clean("   ", "AV")).isEmpty();
        assertThat(CoaValueCleaner.clean(null, "AV")).isNull();
    }
}
