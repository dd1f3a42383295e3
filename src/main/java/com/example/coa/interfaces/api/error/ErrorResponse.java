package com.example.coa.interfaces.api.error;

import java.time.Instant;
import java.util.Map;

/**
 * Error envelope returned by every failing COA endpoint.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {
	/**
	 * @param status  HTTP status code
	 * @param error   stable error code
	 * @param message human readable explanation
	 * @param path    request path that produced the error
	 * @return envelope stamped with the current time and no details
	 */
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path, null);
    }

    public ErrorResponse withDetails(Map<String, Object> newDetails) {
        return new ErrorResponse(timestamp, status, error, message, path, newDetails);
    }
}
