package com.z254.mender.domain.exception;

public class IncidentNotFoundException extends MenderException {

    public IncidentNotFoundException(String incidentId) {
        super("Incident not found: " + incidentId);
    }
}
