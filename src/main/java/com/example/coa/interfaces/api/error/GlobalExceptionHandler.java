package com.example.coa.interfaces.api.error;

import com.example.coa.application.exception.ApplicationException;
import com.example.coa.application.exception.CsvExportValidationException;
import com.example.coa.application.exception.UseCaseValidationException;
import com.example.coa.domain.exception.DocumentNotFoundException;
import com.example.coa.domain.exception.DomainException;
import com.example.coa.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain, application and infrastructure failures of the COA API to {@link ErrorResponse} envelopes.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDocumentNotFound(DocumentNotFoundException ex, HttpServletRequest request) {
        return domainResponse(ex, request, HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND");
    }

	/**
	 * Missing uploads, invalid phases and other domain rule violations. The violated rule is echoed in
	 * {@code details.reason}.
	 */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return domainResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    @ExceptionHandler(CsvExportValidationException.class)
    public ResponseEntity<ErrorResponse> handleCsvExportValidation(CsvExportValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "CSV_EXPORT_VALIDATION_ERROR");
    }

    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "MALFORMED_REQUEST",
                "Request body is missing or is not valid JSON", request.getRequestURI());
        return ResponseEntity.badRequest().body(response);
    }

	/**
	 * Adapter failures outside the per-file upload path, which reports them in its own result.
	 */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        ErrorResponse response = ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR.value(), "INFRASTRUCTURE_ERROR",
                ex.getMessage(), request.getRequestURI()).withDetails(Map.of("cause", ex.errorCode()));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> domainResponse(DomainException ex,
                                                        HttpServletRequest request,
                                                        HttpStatus status,
                                                        String errorCode) {
        log.debug("Rejected {}: {}", request.getRequestURI(), ex.getMessage());
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, ex.getMessage(), request.getRequestURI())
                .withDetails(Map.of("reason", ex.reason()));
        return ResponseEntity.status(status).body(response);
    }

    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
