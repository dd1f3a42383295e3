package com.example.coa.infrastructure.exception;

/**
 * Base unchecked exception for adapter failures (PDF parsing, external processes, workbook IO).
 * A failure of this kind affects a single document and never the whole upload.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failing document or process
	 */
    protected InfrastructureException(String message) {
        super(message);
    }

	/**
	 * @param message context about the failing document or process
	 * @param cause   exception raised by the underlying library
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }

	/**
	 * @return stable code reported in per-file upload diagnostics
	 */
    public abstract String errorCode();
}
