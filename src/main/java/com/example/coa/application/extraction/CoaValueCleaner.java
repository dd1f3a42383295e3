package com.example.coa.application.extraction;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes the value text labs print next to a parameter into the plain form stored in records.
 * <ul>
 *     <li>{@code "19,3 mg KOH/g"} becomes {@code "19.3"}</li>
 *     <li>{@code "Less than 0,5 meq"} becomes {@code "0.5"}, {@code "Less than 0,01 %"} becomes {@code "0.00"}</li>
 *     <li>{@code "Not detected per 25 g"} becomes {@code "negative"}</li>
 *     <li>viscosity at 25°C reported in cP or mPa·s is converted to Pa·s ({@code "4183 cP"} becomes {@code "4.183"})</li>
 * </ul>
 * Text without any number is returned unchanged.
 */
public final class CoaValueCleaner {

    public static final String NEGATIVE = "negative";

    private static final Pattern NOT_DETECTED = Pattern.compile("(?i)\\b(not\\s+detected|nd)\\b");
    private static final Pattern LESS_THAN = Pattern.compile("(?i)less\\s+than\\s+(\\d+(?:[,.]\\d+)?)");
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:[,.]\\d+)?)");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^\\d+(?:[,.]\\d+)?$");
    private static final Pattern VISCOSITY_UNIT = Pattern.compile("\\b(cp|centipoise|mpa\\.?s|pas)\\b");
    private static final BigDecimal SMALL_PERCENTAGE = new BigDecimal("0.01");

    private CoaValueCleaner() {
    }

	/**
	 * @param value     raw value text, may be {@code null}
	 * @param parameter canonical or raw parameter name, used for parameter specific conversions
	 * @return cleaned value, {@code null} or blank input is returned as is
	 */
    public static String clean(String value, String parameter) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        if (NOT_DETECTED.matcher(trimmed).find()) {
            return NEGATIVE;
        }
        boolean viscosity = isViscosity(parameter);

        Matcher lessThan = LESS_THAN.matcher(trimmed);
        if (lessThan.find()) {
            String numeric = lessThan.group(1).replace(',', '.');
            if (trimmed.contains("%") && new BigDecimal(numeric).compareTo(SMALL_PERCENTAGE) <= 0) {
                return "0.00";
            }
            return viscosity ? toPascalSeconds(numeric) : numeric;
        }

        Matcher number = NUMBER.matcher(trimmed);
        if (!number.find()) {
            return trimmed;
        }
        String numeric = number.group(1).replace(',', '.');
        if (trimmed.contains("%") && new BigDecimal(numeric).compareTo(SMALL_PERCENTAGE) < 0) {
            return "0.00";
        }
        if (viscosity) {
            boolean hasUnit = VISCOSITY_UNIT.matcher(trimmed.toLowerCase(Locale.ROOT)).find();
            if (hasUnit && !PLAIN_NUMBER.matcher(trimmed).matches()) {
                return toPascalSeconds(numeric);
            }
        }
        return numeric;
    }

    static boolean isViscosity(String parameter) {
        if (parameter == null) {
            return false;
        }
        String lower = parameter.toLowerCase(Locale.ROOT);
        return lower.contains("viscosity") && lower.contains("25");
    }

    private static String toPascalSeconds(String centipoise) {
        return new BigDecimal(centipoise).movePointLeft(3).stripTrailingZeros().toPlainString();
    }
}
