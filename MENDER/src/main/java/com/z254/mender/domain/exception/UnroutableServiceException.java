package com.z254.mender.domain.exception;

/**
 * No repository mapping exists for a service.
 */
public class UnroutableServiceException extends MenderException {

    private final String serviceName;

    public UnroutableServiceException(String serviceName) {
        super("No repository mapping for service: " + serviceName);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
