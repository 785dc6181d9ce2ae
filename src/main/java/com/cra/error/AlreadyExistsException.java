package com.cra.error;

/**
 * Thrown when creating a session with an id already in use, or when an atlas
 * is loaded a second time without an explicit reload.
 */
public class AlreadyExistsException extends CraException {

    public AlreadyExistsException(String kind, String id) {
        super(ErrorCode.ALREADY_EXISTS, kind + " already exists: " + id);
    }
}
