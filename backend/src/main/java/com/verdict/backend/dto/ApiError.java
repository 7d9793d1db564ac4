package com.verdict.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body of every rejected analysis request. {@code details} lists the offending fields and is omitted when empty.
 */
public record ApiError(
        Instant timestamp,
        String path,
        int status,
        String error,
        String message,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ApiErrorDetail> details
) {

    public ApiError {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static ApiError of(HttpStatus status, String message, List<ApiErrorDetail> details, String path) {
        return new ApiError(Instant.now(), path, status.value(), status.getReasonPhrase(), message, details);
    }
}
