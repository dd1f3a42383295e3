package com.example.coa.application.exception;

/**
 * Raised when a COA use case receives input it cannot act on, such as an empty id list for deletion.
 * Mapped to HTTP 400.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
