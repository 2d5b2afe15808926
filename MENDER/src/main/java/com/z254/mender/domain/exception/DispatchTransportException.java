package com.z254.mender.domain.exception;

/**
 * The remediation job could not be triggered on one attempt.
 */
public class DispatchTransportException extends MenderException {

    private final int statusCode;

    public DispatchTransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DispatchTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by the CI provider, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
