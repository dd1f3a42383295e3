package com.example.coa.application.exception;

/**
 * Base unchecked exception for use-case failures of the COA services.
 * Services throw subclasses to reject a request before any record is touched.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message description returned to the API caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }

	/**
	 * @param message description returned to the API caller
	 * @param cause   failure raised by a collaborator
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
