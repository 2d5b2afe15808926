package com.z254.mender.domain.exception;

import java.util.List;

/**
 * Malformed inbound incident, rejected before anything is persisted.
 */
public class IncidentValidationException extends MenderException {

    private final List<String> violations;

    public IncidentValidationException(List<String> violations) {
        super("Invalid incident: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
