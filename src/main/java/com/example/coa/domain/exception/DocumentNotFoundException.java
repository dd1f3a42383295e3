package com.example.coa.domain.exception;

/**
 * Raised when a referenced COA document path does not exist on disk.
 */
public class DocumentNotFoundException extends DomainException {

	/**
	 * @param path absolute or relative path that could not be resolved
	 */
    public DocumentNotFoundException(String path) {
        super("COA document not found: " + path);
    }

    @Override
    public String reason() {
        return "DOCUMENT_NOT_FOUND";
    }
}
