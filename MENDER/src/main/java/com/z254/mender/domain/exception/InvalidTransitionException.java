package com.z254.mender.domain.exception;

import com.z254.mender.domain.model.IncidentStatus;

/**
 * Illegal lifecycle transition; the incident is left unchanged.
 */
public class InvalidTransitionException extends MenderException {

    private final String incidentId;
    private final IncidentStatus from;
    private final IncidentStatus to;

    public InvalidTransitionException(String incidentId, IncidentStatus from, IncidentStatus to) {
        super("Invalid status transition for incident " + incidentId + " from " + from + " to " + to);
        this.incidentId = incidentId;
        this.from = from;
        this.to = to;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public IncidentStatus getFrom() {
        return from;
    }

    public IncidentStatus getTo() {
        return to;
    }
}
