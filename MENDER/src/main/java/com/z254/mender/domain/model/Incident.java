package com.z254.mender.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Incident entity: one normalized failure reported by an observability provider.
 * <p>
 * Status changes after creation go through
 * {@link com.z254.mender.domain.service.IncidentLifecycle}; the store owns {@link #version}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Unique incident identifier */
    private String id;

    /** Service that reported the error */
    private String serviceName;

    /** Target repository ({@code owner/name}), empty when unroutable */
    @Builder.Default
    private String repository = "";

    /** Error message as reported */
    private String errorMessage;

    /** Optional stack trace */
    private String stackTrace;

    /** Severity (critical, high, medium, low) */
    private String severity;

    /** Current lifecycle status */
    @Builder.Default
    private IncidentStatus status = IncidentStatus.PENDING;

    /** Observability provider name */
    private String provider;

    /** Provider-specific payload, never interpreted by the orchestrator */
    @Builder.Default
    private Map<String, Object> providerData = new HashMap<>();

    /** External remediation run identifier */
    private String workflowRunId;

    /** Pull request opened by the remediation job */
    private String pullRequestUrl;

    /** Diagnosis reported by the remediation job */
    private String diagnosis;

    private Instant createdAt;

    private Instant updatedAt;

    /** Set the first time the incident enters workflow_triggered */
    private Instant triggeredAt;

    /** Set the first time the incident reaches resolved, failed or no_fix_needed */
    private Instant completedAt;

    /** Optimistic concurrency token */
    private long version;

    /**
     * Detached copy; the provider data map is copied so the store never shares mutable state.
     */
    public Incident copy() {
        return toBuilder()
                .providerData(providerData != null ? new HashMap<>(providerData) : new HashMap<>())
                .build();
    }

    public boolean isRouted() {
        return repository != null && !repository.isEmpty();
    }

    /**
     * Whether a remediation job is currently running for this incident.
     */
    public boolean isDispatchActive() {
        return status != null && status.isDispatchActive();
    }
}
