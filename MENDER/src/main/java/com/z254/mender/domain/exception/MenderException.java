package com.z254.mender.domain.exception;

/**
 * Base class for orchestration errors.
 */
public class MenderException extends RuntimeException {

    public MenderException(String message) {
        super(message);
    }

    public MenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
