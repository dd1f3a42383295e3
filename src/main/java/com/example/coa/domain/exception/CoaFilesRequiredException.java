package com.example.coa.domain.exception;

/**
 * Raised when an upload request carries no COA documents at all.
 * This is the only upload condition that fails the whole request instead of a single file.
 */
public class CoaFilesRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public CoaFilesRequiredException() {
        super("No files uploaded. Use the 'files' field.");
    }

    @Override
    public String reason() {
        return "FILES_REQUIRED";
    }
}
