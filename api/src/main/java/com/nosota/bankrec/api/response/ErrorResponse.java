package com.nosota.bankrec.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Error body returned for every failed request.
 *
 * <p>{@code code} identifies the failure kind (e.g. {@code UNBALANCED_SELECTION},
 * {@code NOT_BALANCED}) and {@code details} carries the structured data needed to
 * render an actionable message: mismatched sums, offending record IDs, tolerance.
 *
 * @param status    HTTP status code
 * @param error     Short error title
 * @param code      Machine-readable error code
 * @param message   Human-readable message
 * @param path      Request path
 * @param details   Structured failure details
 * @param timestamp Time of the failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String error,
        String code,
        String message,
        String path,
        Map<String, Object> details,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(int status, String error, String code, String message,
                                   String path, Map<String, Object> details) {
        return new ErrorResponse(status, error, code, message, path, details, LocalDateTime.now());
    }

    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return of(status, error, code, message, path, null);
    }
}
