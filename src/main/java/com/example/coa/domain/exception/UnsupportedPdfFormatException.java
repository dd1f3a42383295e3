package com.example.coa.domain.exception;

/**
 * Raised when an uploaded file does not resemble a PDF according to the domain rules.
 * During batch uploads it only rejects the offending file.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }

    @Override
    public String reason() {
        return "UNSUPPORTED_FORMAT";
    }
}
