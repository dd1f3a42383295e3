package com.example.coa.application.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Optional;

/**
 * Sums of measured sub-components reported as one parameter (LPC from its 1- and 2- fractions,
 * Heavy Metals from As, Cd, Pb and Hg).
 * Addition is exact; the total is rounded to two decimals half-up and rendered without trailing zeros.
 */
public final class DerivedValues {

    static final int SCALE = 2;

    private DerivedValues() {
    }

	/**
	 * @param components cleaned component values; {@code null} and non-numeric entries are skipped
	 * @return formatted sum, empty when no component is numeric
	 */
    public static Optional<String> sum(Collection<String> components) {
        BigDecimal total = null;
        for (String component : components) {
            BigDecimal value = parse(component);
            if (value != null) {
                total = total == null ? value : total.add(value);
            }
        }
        return Optional.ofNullable(total).map(DerivedValues::format);
    }

    static String format(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    static BigDecimal parse(String value) {
        if (value == null) {
            return null;
        }
        String candidate = value.trim().replace(',', '.');
        if (candidate.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(candidate);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
