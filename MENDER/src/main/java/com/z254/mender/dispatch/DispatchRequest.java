package com.z254.mender.dispatch;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything a remediation job needs to start work on one incident.
 */
@Value
@Builder
public class DispatchRequest {
    String dispatchId;
    String incidentId;
    String repository;
    String branch;
    String serviceName;
    String errorMessage;
    String stackTrace;
    Instant timestamp;
}
