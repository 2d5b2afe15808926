package com.z254.mender.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported by the remediation workflow.
 */
public enum WorkflowOutcome {

    /** Job finished; a pull request URL means a fix was proposed */
    SUCCESS("success"),
    FAILED("failed"),
    NO_FIX_NEEDED("no_fix_needed"),
    /** Job picked up by a runner; does not complete the cycle */
    IN_PROGRESS("in_progress");

    private final String value;

    WorkflowOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static WorkflowOutcome fromValue(String value) {
        for (WorkflowOutcome outcome : values()) {
            if (outcome.value.equalsIgnoreCase(value) || outcome.name().equalsIgnoreCase(value)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown workflow outcome: " + value);
    }
}
