package com.nosota.tradeflow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.MDC;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Error body returned by every failed API call.
 *
 * @param timestamp     When the error was produced
 * @param status        HTTP status code
 * @param error         Short error title
 * @param message       Human readable message
 * @param path          Request URI
 * @param correlationId Correlation ID of the request, also present in the logs
 * @param details       Structured details (entity id, current state, attempted action, ...)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId,
        Map<String, Object> details
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return of(status, error, message, path, Map.of());
    }

    public static ErrorResponse of(int status, String error, String message, String path,
                                   Map<String, Object> details) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path,
                MDC.get("correlationId"), details);
    }
}
