package com.example.coa.infrastructure.exception;

/**
 * Signals that PDFBox could not open or parse a COA document.
 */
public class DocumentUnreadableException extends InfrastructureException {

	/**
	 * @param message description naming the document
	 * @param cause   low-level PDFBox exception
	 */
    public DocumentUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "DOCUMENT_UNREADABLE";
    }
}
