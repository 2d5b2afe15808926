package com.z254.mender.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Incident lifecycle states and the legal transitions between them.
 */
public enum IncidentStatus {

    PENDING("pending"),
    WORKFLOW_TRIGGERED("workflow_triggered"),
    IN_PROGRESS("in_progress"),
    PR_CREATED("pr_created"),
    RESOLVED("resolved"),
    FAILED("failed"),
    NO_FIX_NEEDED("no_fix_needed");

    private static final Map<IncidentStatus, Set<IncidentStatus>> TRANSITIONS = new EnumMap<>(IncidentStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(WORKFLOW_TRIGGERED, FAILED));
        TRANSITIONS.put(WORKFLOW_TRIGGERED, EnumSet.of(IN_PROGRESS, FAILED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(PR_CREATED, FAILED, NO_FIX_NEEDED));
        TRANSITIONS.put(PR_CREATED, EnumSet.of(RESOLVED, FAILED));
        // retry path
        TRANSITIONS.put(FAILED, EnumSet.of(PENDING));
        TRANSITIONS.put(NO_FIX_NEEDED, EnumSet.noneOf(IncidentStatus.class));
        TRANSITIONS.put(RESOLVED, EnumSet.noneOf(IncidentStatus.class));
    }

    private final String value;

    IncidentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<IncidentStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    /**
     * States that stamp {@code completedAt}: the end of a remediation cycle.
     */
    public boolean isCompletion() {
        return this == RESOLVED || this == FAILED || this == NO_FIX_NEEDED;
    }

    /**
     * No outgoing transitions at all.
     */
    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * A remediation job holds a dispatch slot in these states.
     */
    public boolean isDispatchActive() {
        return this == WORKFLOW_TRIGGERED || this == IN_PROGRESS;
    }

    @JsonCreator
    public static IncidentStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (IncidentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown incident status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
