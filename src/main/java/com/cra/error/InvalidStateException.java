package com.cra.error;

public class InvalidStateException extends CraException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
