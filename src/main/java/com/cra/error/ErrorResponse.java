package com.cra.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * What a transport sends back when an engine call fails.
 *
 * A {@link CraException} keeps its {@link ErrorCode} and message. Anything
 * else is reported as {@code INTERNAL_ERROR} with a fixed message, the cause
 * going to the log only.
 */
@JsonPropertyOrder({"error_code", "message", "timestamp"})
public record ErrorResponse(
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("message") String message,
    @JsonProperty("timestamp") String timestamp
) {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponse.class);

    public static ErrorResponse from(Throwable error) {
        if (error instanceof CraException cra) {
            log.warn("{}: {}", cra.getErrorCode().code(), cra.getMessage());
            return new ErrorResponse(cra.getErrorCode().code(), cra.getMessage(), Instant.now().toString());
        }
        log.error("Unexpected error", error);
        return new ErrorResponse(ErrorCode.INTERNAL_ERROR.code(), "an unexpected error occurred",
            Instant.now().toString());
    }

    public static int statusOf(Throwable error) {
        if (error instanceof CraException cra) {
            return cra.getErrorCode().status();
        }
        return ErrorCode.INTERNAL_ERROR.status();
    }
}
