package com.example.coa.infrastructure.exception;

/**
 * Failure of the external parser process: non-zero exit, timeout or output that is not a JSON object.
 */
public class ExternalParserException extends InfrastructureException {

    public ExternalParserException(String message) {
        super(message);
    }

    public ExternalParserException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "EXTERNAL_PARSER_FAILED";
    }
}
