package com.example.coa.domain.model;

import com.example.coa.domain.exception.InvalidExtractionPhaseException;

/**
 * Scoping tier that decides which subset of canonical parameters an extraction run targets.
 */
public enum ExtractionPhase {
    PHASE_1(1),
    PHASE_2(2);

    private final int number;

    ExtractionPhase(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

	/**
	 * Resolves a phase from its number.
	 *
	 * @param number 1 or 2
	 * @return matching phase
	 * @throws InvalidExtractionPhaseException for any other number
	 */
    public static ExtractionPhase fromNumber(int number) {
        for (ExtractionPhase phase : values()) {
            if (phase.number == number) {
                return phase;
            }
        }
        throw new InvalidExtractionPhaseException(String.valueOf(number));
    }

	/**
	 * Parses a request parameter. Missing or blank values default to {@link #PHASE_1}.
	 *
	 * @param rawValue value supplied by the HTTP layer
	 * @return parsed phase
	 * @throws InvalidExtractionPhaseException when the value is neither 1 nor 2
	 */
    public static ExtractionPhase parse(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return PHASE_1;
        }
        try {
            return fromNumber(Integer.parseInt(rawValue.trim()));
        } catch (NumberFormatException ex) {
            throw new InvalidExtractionPhaseException(rawValue);
        }
    }
}
