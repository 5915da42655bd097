package org.pivotgrid.node.processes.http.api.dto;

import io.javalin.http.HttpStatus;

import java.time.Instant;

/**
 * Body of error responses that are not pivot results: malformed requests and internal errors.
 *
 * @param timestamp ISO-8601 time of the error
 * @param status    HTTP status code
 * @param error     HTTP reason phrase
 * @param message   human-readable description
 */
public record ErrorResponseDto(String timestamp, int status, String error, String message) {

    public static ErrorResponseDto of(final HttpStatus status, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status.getCode(), status.getMessage(), message);
    }
}
