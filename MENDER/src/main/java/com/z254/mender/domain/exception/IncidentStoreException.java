package com.z254.mender.domain.exception;

/**
 * Persistence failure. The triggering operation must not be assumed to have taken effect.
 */
public class IncidentStoreException extends MenderException {

    public IncidentStoreException(String message) {
        super(message);
    }

    public IncidentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
