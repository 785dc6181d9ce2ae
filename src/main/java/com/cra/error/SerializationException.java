package com.cra.error;

public class SerializationException extends CraException {

    public SerializationException(String message, Throwable cause) {
        super(ErrorCode.SERIALIZATION_ERROR, message, cause);
    }
}
