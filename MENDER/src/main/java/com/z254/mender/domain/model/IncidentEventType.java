package com.z254.mender.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Audit event types recorded in the incident trail.
 */
public enum IncidentEventType {

    INCIDENT_RECEIVED("incident_received"),
    WORKFLOW_TRIGGERED("workflow_triggered"),
    WORKFLOW_IN_PROGRESS("workflow_in_progress"),
    PR_CREATED("pr_created"),
    INCIDENT_RESOLVED("incident_resolved"),
    INCIDENT_FAILED("incident_failed"),
    MANUAL_TRIGGER("manual_trigger"),
    STATUS_CHANGED("status_changed"),
    DUPLICATE_DETECTED("duplicate_detected"),
    QUEUED_FOR_REMEDIATION("queued_for_remediation"),
    DEQUEUED_FOR_REMEDIATION("dequeued_for_remediation"),
    DISPATCH_FAILED("dispatch_failed");

    private final String value;

    IncidentEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
