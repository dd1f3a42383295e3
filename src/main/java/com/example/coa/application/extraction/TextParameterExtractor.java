package com.example.coa.application.extraction;

import com.example.coa.domain.model.DocumentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic extraction from the running text of certificates that report results line by line
 * (Nofalab and TLR style) instead of in a table.
 * Only keys present in the target column list are emitted; candidate names are compared case-insensitively.
 */
@Component
public class TextParameterExtractor {

    private static final Logger log = LoggerFactory.getLogger(TextParameterExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final Pattern ACETONE_INSOLUBLE = Pattern.compile("(?:Acetone|Aceton)\\s+insoluble\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern ACID_VALUE = Pattern.compile("Acid\\s+value\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern PEROXIDE_VALUE = Pattern.compile("Peroxide\\s+value\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern MEANINGFUL_RESULT = Pattern.compile("\\d|not\\s+detected|less\\s+than", FLAGS);
    private static final Pattern COLOR_GARDNER_DILUTED =
            Pattern.compile("Color\\s+Gardner[^\\n\\r]*?(?:10|10%)\\b[^\\n\\r]*?(\\d+(?:[.,]\\d+)?)\\b", FLAGS);
    private static final Pattern VISCOSITY_SAME_LINE = Pattern.compile("Viscosity\\s+at\\s+25\\s*°?C[ \\t:]*([^\\n\\r]+)", FLAGS);
    private static final Pattern VISCOSITY_NEXT_CHARS = Pattern.compile("Viscosity\\s+at\\s+25\\s*°?C[\\s:]*([\\s\\S]{0,40})", FLAGS);
    private static final Pattern HEXANE_INSOLUBLE = Pattern.compile("Hexane\\s+insoluble(?:\\s+matter)?\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern TOLUENE_INSOLUBLE = Pattern.compile("Toluene\\s+insoluble(?:\\s+matter)?\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern MOISTURE = Pattern.compile("Moisture[\\s\\S]{0,30}?([0-9]+[.,][0-9]+\\s*%[^\\n\\r]*)", FLAGS);
    private static final Pattern ENTEROBACTERIACEAE = Pattern.compile("Enterobacteriaceae\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern TOTAL_PLATE_COUNT = Pattern.compile("Total\\s+plate\\s+count[^\\n\\r]*?(\\d[\\d\\s.,]*\\s*cfu/g)", FLAGS);
    private static final Pattern YEASTS_AND_MOULDS = Pattern.compile("Yeasts\\s*(?:&|and)\\s*mou?lds\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern YEASTS_ONLY = Pattern.compile("^[ \\t]*Yeasts\\s+(?:Less\\s+than\\s+)?([^\\n\\r&]+)$", FLAGS);
    private static final Pattern MOULDS_ONLY = Pattern.compile("^[ \\t]*Mou?lds\\s+(?:Less\\s+than\\s+)?([^\\n\\r&]+)$", FLAGS);
    private static final Pattern SALMONELLA = Pattern.compile("Salmonella(?:\\s+spp\\.?)?\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern PAH4 = Pattern.compile("(?:Sum\\s+of\\s+)?PAH\\s*[- ]?4\\S*\\s*([^\\n\\r]*)", FLAGS);
    private static final Pattern OCHRATOXIN_WITH_CAS = Pattern.compile("Ochratoxin\\s+A\\s*\\([^)]+\\)\\s*([^\\n\\r±]*)", FLAGS);
    private static final Pattern OCHRATOXIN = Pattern.compile("Ochratoxin\\s+A\\s*([^\\n\\r±]*)", FLAGS);
    private static final Pattern GMO_LINE = Pattern.compile("GMO[^\\n\\r]*", FLAGS);
    private static final Pattern NEGATIVE_RESULT = Pattern.compile("negative|not\\s+detected|\\bnd\\b", FLAGS);
    private static final Pattern POSITIVE_RESULT = Pattern.compile("positive|\\bdetected\\b", FLAGS);
    private static final Pattern PEANUT_NEGATIVE = Pattern.compile("Peanut[^\\n\\r]*(?:not\\s+detected|negative)", FLAGS);
    private static final Pattern PEANUT_NUMERIC = Pattern.compile("Peanut[^\\n\\r]*?(\\d+(?:[.,]\\d+)?)\\s*(?:mg/kg|ppm)", FLAGS);
    private static final List<Pattern> PESTICIDE_MENTIONS = List.of(
            Pattern.compile("pesticides?\\s*(?:residues?)?\\s*([^\\n\\r]*)", FLAGS),
            Pattern.compile("organochlorines?\\s*([^\\n\\r]*)", FLAGS),
            Pattern.compile("organophosphates?\\s*([^\\n\\r]*)", FLAGS),
            Pattern.compile("chlorpyrifos\\s*([^\\n\\r]*)", FLAGS),
            Pattern.compile("dimethoate\\s*([^\\n\\r]*)", FLAGS),
            Pattern.compile("malathion\\s*([^\\n\\r]*)", FLAGS));

    static final String HEAVY_METALS = "Heavy Metals";
    static final String PESTICIDES = "Pesticides";
    static final String REVIEW = "review";

	/**
	 * @param text         full document text
	 * @param targets      column names the run may emit
	 * @param documentType detected laboratory family; pesticide screening is skipped for phospholipid reports
	 * @return target column to cleaned value, in rule order
	 */
    public Map<String, String> extract(String text, Collection<String> targets, DocumentType documentType) {
        Map<String, String> out = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        Extraction extraction = new Extraction(targets, out);

        extraction.put(capture(ACETONE_INSOLUBLE, text), "AI", "Acetone Insoluble", "Aceton insoluble");
        extraction.put(capture(ACID_VALUE, text), "AV", "Acid Value");
        extraction.put(peroxideValue(text), "POV", "Peroxide Value");
        extraction.put(capture(COLOR_GARDNER_DILUTED, text), "Color Gardner (10% dil.)");
        extraction.put(viscosity(text), "Viscosity at 25°C");
        extraction.put(capture(HEXANE_INSOLUBLE, text), "Hexane Insolubles", "Hexane insoluble matter");
        extraction.put(capture(TOLUENE_INSOLUBLE, text), "Toluene Insolubles", "Toluene insoluble matter");
        extraction.put(capture(MOISTURE, text), "Moisture");

        extraction.put(metal(text, "Iron", "Fe"), "Iron (Fe)", "Iron");
        String lead = extraction.put(metal(text, "Lead", "Pb"), "Lead", "Lead (Pb)");
        String arsenic = extraction.put(metal(text, "Arsenic", "As"), "Arsenic", "Arsenic (As)");
        String mercury = extraction.put(metal(text, "Mercury", "Hg"), "Mercury", "Mercury (Hg)");
        String cadmiumRaw = metal(text, "Cadmium", "Cd");
        String cadmium = extraction.put(cadmiumRaw, "Cadmium", "Cadmium (Cd)");
        if (cadmium == null && cadmiumRaw != null) {
            cadmium = CoaValueCleaner.clean(cadmiumRaw, "Cadmium");
        }
        List<String> heavyMetals = new ArrayList<>();
        for (String value : new String[]{arsenic, cadmium, lead, mercury}) {
            if (value != null) {
                heavyMetals.add(value);
            }
        }
        Optional<String> heavyMetalSum = DerivedValues.sum(heavyMetals);
        if (heavyMetalSum.isPresent()) {
            extraction.putClean(heavyMetalSum.get(), HEAVY_METALS);
        }

        extraction.put(capture(ENTEROBACTERIACEAE, text), "Enterobacteriaceae");
        extraction.put(capture(TOTAL_PLATE_COUNT, text), "Total Plate Count");
        extraction.put(capture(YEASTS_AND_MOULDS, text), "Yeasts & Molds", "Yeasts & Moulds");
        extraction.put(capture(YEASTS_ONLY, text), "Yeasts");
        extraction.put(capture(MOULDS_ONLY, text), "Moulds", "Molds");
        extraction.put(capture(SALMONELLA, text), "Salmonella (in 25g)", "Salmonella (in 250g)");
        extraction.put(capture(PAH4, text), "PAH4");
        extraction.put(ochratoxin(text), "Ochratoxin A");
        extraction.putClean(gmoScreening(text), "PCR, 50 cycl. (GMO), 35S/NOS/FMV");
        extraction.putClean(peanut(text), "Peanut content");

        if (documentType != DocumentType.SPECTRAL_SERVICE) {
            extraction.putClean(pesticideVerdict(text), PESTICIDES);
        }
        log.debug("Text rules produced {} values", out.size());
        return out;
    }

    private static String capture(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }

	/**
	 * Peroxide value is often printed twice (limit and result); the last occurrence carrying a result wins.
	 */
    private static String peroxideValue(String text) {
        Matcher matcher = PEROXIDE_VALUE.matcher(text);
        String withResult = null;
        String last = null;
        while (matcher.find()) {
            String candidate = matcher.group(1).trim();
            last = candidate;
            if (MEANINGFUL_RESULT.matcher(candidate).find()) {
                withResult = candidate;
            }
        }
        String value = withResult != null ? withResult : last;
        return value == null || value.isEmpty() ? null : value;
    }

    private static String viscosity(String text) {
        String sameLine = capture(VISCOSITY_SAME_LINE, text);
        return sameLine != null ? sameLine : capture(VISCOSITY_NEXT_CHARS, text);
    }

    private static String metal(String text, String name, String symbol) {
        String withCas = capture(Pattern.compile(name + "\\s*\\(" + symbol + "\\)\\s*\\([^)]+\\)\\s*([^\\n\\r]*)", FLAGS), text);
        if (withCas != null) {
            return withCas;
        }
        return capture(Pattern.compile(name + "\\s*\\(?" + symbol + "\\)?\\s*([^\\n\\r]*)", FLAGS), text);
    }

    private static String ochratoxin(String text) {
        String value = capture(OCHRATOXIN_WITH_CAS, text);
        if (value == null) {
            value = capture(OCHRATOXIN, text);
        }
        return value == null ? null : value.replaceAll("\\s*±.*$", "");
    }

    private static String gmoScreening(String text) {
        Matcher matcher = GMO_LINE.matcher(text);
        boolean positive = false;
        while (matcher.find()) {
            String line = matcher.group();
            if (NEGATIVE_RESULT.matcher(line).find()) {
                return CoaValueCleaner.NEGATIVE;
            }
            positive |= POSITIVE_RESULT.matcher(line).find();
        }
        return positive ? "positive" : null;
    }

    private static String peanut(String text) {
        if (PEANUT_NEGATIVE.matcher(text).find()) {
            return CoaValueCleaner.NEGATIVE;
        }
        String numeric = capture(PEANUT_NUMERIC, text);
        return numeric == null ? null : CoaValueCleaner.clean(numeric, "Peanut content");
    }

	/**
	 * Mixed detected and not-detected pesticide mentions need a human review; only not-detected ones are negative.
	 */
    static String pesticideVerdict(String text) {
        int detected = 0;
        int notDetected = 0;
        for (Pattern pattern : PESTICIDE_MENTIONS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String value = matcher.group(1).trim().toLowerCase(Locale.ROOT);
                if (value.contains("not detected") || value.contains("negative") || value.contains("<")) {
                    notDetected++;
                } else if (value.contains("detected") || value.contains("positive") || value.chars().anyMatch(Character::isDigit)) {
                    detected++;
                }
            }
        }
        if (detected > 0 && notDetected > 0) {
            return REVIEW;
        }
        return notDetected > 0 ? CoaValueCleaner.NEGATIVE : null;
    }

    private static final class Extraction {
        private final Collection<String> targets;
        private final Map<String, String> out;

        private Extraction(Collection<String> targets, Map<String, String> out) {
            this.targets = targets;
            this.out = out;
        }

		/**
		 * Cleans and stores a raw value under the first candidate present in the targets.
		 *
		 * @return cleaned value when stored, otherwise {@code null}
		 */
        String put(String rawValue, String... candidates) {
            if (rawValue == null) {
                return null;
            }
            String key = resolveKey(candidates);
            if (key == null) {
                return null;
            }
            String cleaned = CoaValueCleaner.clean(rawValue, key);
            out.putIfAbsent(key, cleaned);
            return cleaned;
        }

        void putClean(String value, String... candidates) {
            if (value == null) {
                return;
            }
            String key = resolveKey(candidates);
            if (key != null) {
                out.putIfAbsent(key, value);
            }
        }

        private String resolveKey(String... candidates) {
            for (String candidate : candidates) {
                for (String target : targets) {
                    if (target != null && target.trim().equalsIgnoreCase(candidate.trim())) {
                        return target;
                    }
                }
            }
            return null;
        }
    }
}
