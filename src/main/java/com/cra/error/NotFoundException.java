package com.cra.error;

/**
 * Thrown when a session, atlas or trace is not known to the engine.
 */
public class NotFoundException extends CraException {

    public NotFoundException(String kind, String id) {
        super(ErrorCode.NOT_FOUND, kind + " not found: " + id);
    }
}
