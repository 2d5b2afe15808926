package com.z254.mender.domain.exception;

/**
 * Dispatch transport failed on every attempt.
 */
public class DispatchFailureException extends MenderException {

    private final String repository;
    private final int attempts;

    public DispatchFailureException(String repository, int attempts, Throwable cause) {
        super("Workflow dispatch for " + repository + " failed after " + attempts + " attempts: "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.repository = repository;
        this.attempts = attempts;
    }

    public String getRepository() {
        return repository;
    }

    public int getAttempts() {
        return attempts;
    }
}
