package com.example.coa.domain.exception;

/**
 * Raised when a request names an extraction phase other than 1 or 2.
 */
public class InvalidExtractionPhaseException extends DomainException {

	/**
	 * @param rawPhase phase value as received from the caller
	 */
    public InvalidExtractionPhaseException(String rawPhase) {
        super("Unsupported extraction phase: " + rawPhase + ". Expected 1 or 2.");
    }

    @Override
    public String reason() {
        return "INVALID_PHASE";
    }
}
