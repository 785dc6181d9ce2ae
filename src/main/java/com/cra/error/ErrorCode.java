package com.cra.error;

/**
 * Stable, machine-readable error codes surfaced to every transport.
 * The status is the HTTP-style status a REST transport should answer with.
 */
public enum ErrorCode {
    NOT_FOUND("NOT_FOUND", 404),
    ALREADY_EXISTS("ALREADY_EXISTS", 409),
    INVALID_STATE("INVALID_STATE", 409),
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    CHAIN_INTEGRITY_ERROR("CHAIN_INTEGRITY_ERROR", 500),
    SERIALIZATION_ERROR("SERIALIZATION_ERROR", 400),
    BACKPRESSURE("BACKPRESSURE", 503),
    ACTION_DENIED("ACTION_DENIED", 403),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int status;

    ErrorCode(String code, int status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public int status() {
        return status;
    }
}
