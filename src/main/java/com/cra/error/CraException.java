package com.cra.error;

/**
 * Base type for every typed failure raised by the resolution engine.
 */
public abstract class CraException extends RuntimeException {

    private final ErrorCode errorCode;

    protected CraException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CraException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
