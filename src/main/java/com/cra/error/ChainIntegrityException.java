package com.cra.error;

/**
 * Raised only when a caller explicitly asks for a verification result to be
 * enforced. Verification itself reports breaks as data.
 */
public class ChainIntegrityException extends CraException {

    private final String sessionId;
    private final Integer firstInvalidIndex;

    public ChainIntegrityException(String sessionId, Integer firstInvalidIndex, String message) {
        super(ErrorCode.CHAIN_INTEGRITY_ERROR, message);
        this.sessionId = sessionId;
        this.firstInvalidIndex = firstInvalidIndex;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Integer getFirstInvalidIndex() {
        return firstInvalidIndex;
    }
}
