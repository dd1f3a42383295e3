package com.example.coa.domain.exception;

/**
 * Base type for COA rule violations: requests the domain refuses to process.
 * Each subclass names its rule through {@link #reason()}, which upload diagnostics and error envelopes report
 * next to the message.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }

	/**
	 * @return stable upper-case code of the violated rule
	 */
    public abstract String reason();
}
