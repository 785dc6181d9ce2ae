package com.cra.error;

import java.util.List;

/**
 * Thrown for malformed but well-typed input: blank ids, missing goal,
 * structurally invalid manifests.
 */
public class ValidationException extends CraException {

    private final List<String> violations;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.violations = List.of(message);
    }

    public ValidationException(String subject, List<String> violations) {
        super(ErrorCode.VALIDATION_ERROR, subject + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
