package com.z254.mender.domain.exception;

import com.z254.mender.domain.model.IncidentStatus;

/**
 * A remediation job is already running for the incident.
 */
public class IncidentBusyException extends MenderException {

    public IncidentBusyException(String incidentId, IncidentStatus status) {
        super("Incident " + incidentId + " already has an active remediation (" + status + ")");
    }
}
