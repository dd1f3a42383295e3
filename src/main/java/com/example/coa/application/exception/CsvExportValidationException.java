package com.example.coa.application.exception;

/**
 * Export request that cannot produce a CSV file, for example because no rows were selected.
 * Mapped to HTTP 422.
 */
public class CsvExportValidationException extends UseCaseValidationException {

	/**
	 * @param message reason shown to the user
	 */
    public CsvExportValidationException(String message) {
        super(message);
    }
}
