package com.z254.mender.domain.exception;

public class RoutingRuleValidationException extends MenderException {

    public RoutingRuleValidationException(String message) {
        super(message);
    }

    public RoutingRuleValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
