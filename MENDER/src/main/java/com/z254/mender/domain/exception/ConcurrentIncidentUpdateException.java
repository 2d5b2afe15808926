package com.z254.mender.domain.exception;

/**
 * Optimistic version check failed: another writer updated the incident first.
 */
public class ConcurrentIncidentUpdateException extends IncidentStoreException {

    public ConcurrentIncidentUpdateException(String incidentId, long expectedVersion, long actualVersion) {
        super("Incident " + incidentId + " was modified concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")");
    }
}
