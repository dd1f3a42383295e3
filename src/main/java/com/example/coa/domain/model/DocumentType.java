package com.example.coa.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * Laboratory document family detected from the COA text. Drives lab-specific table heuristics.
 */
public enum DocumentType {
    SPECTRAL_SERVICE("Spectral Service AG", List.of("spectral service ag", "spectral service", "spectral ag", "weight-%")),
    GENERIC(null, List.of());

    private final String displayName;
    private final List<String> indicators;

    DocumentType(String displayName, List<String> indicators) {
        this.displayName = displayName;
        this.indicators = indicators;
    }

	/**
	 * @return label reported under the {@code document_type} key, {@code null} for generic documents
	 */
    public String displayName() {
        return displayName;
    }

	/**
	 * Detects the document family by looking for known lab header phrases.
	 *
	 * @param text full document text
	 * @return detected type, {@link #GENERIC} when no lab phrase matches
	 */
    public static DocumentType detect(String text) {
        if (text == null || text.isBlank()) {
            return GENERIC;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            for (String indicator : type.indicators) {
                if (lower.contains(indicator)) {
                    return type;
                }
            }
        }
        return GENERIC;
    }

	/**
	 * Reverse lookup of {@link #displayName()}, used when results come back from an external parser.
	 */
    public static DocumentType fromDisplayName(String value) {
        if (value == null) {
            return GENERIC;
        }
        for (DocumentType type : values()) {
            if (type.displayName != null && type.displayName.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return GENERIC;
    }
}
