package com.scanq.error;

import java.time.OffsetDateTime;

/**
 * JSON error body returned by the HTTP endpoints.
 */
public record ErrorResponse(boolean success, Error error, Metadata metadata) {

    public static ErrorResponse of(ClassifiedError classified, OffsetDateTime timestamp) {
        return new ErrorResponse(false,
                new Error(classified.kind(), classified.message(), classified.userMessage()),
                new Metadata(timestamp, classified.retryable()));
    }

    public record Error(ErrorKind code, String message, String userMessage) {
    }

    public record Metadata(OffsetDateTime timestamp, boolean retryable) {
    }
}
