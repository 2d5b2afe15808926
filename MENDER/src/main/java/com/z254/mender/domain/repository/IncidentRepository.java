package com.z254.mender.domain.repository;

import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for incident persistence.
 * <p>
 * Implementations return detached copies: callers mutate a copy and write it back through
 * {@link #update(Incident)}.
 */
public interface IncidentRepository {

    /**
     * Persist a new incident. Fails if the id is already taken.
     */
    Incident create(Incident incident);

    /**
     * Look up an incident by ID.
     */
    Optional<Incident> findById(String id);

    /**
     * Replace a stored incident. The incident's version must match the stored version,
     * otherwise {@link com.z254.mender.domain.exception.ConcurrentIncidentUpdateException} is thrown.
     *
     * @return the stored copy carrying the new version
     */
    Incident update(Incident incident);

    /**
     * Overwrite the status without lifecycle validation, timestamps or audit events.
     * Store maintenance only: status changes made by the orchestration engine go through
     * {@link com.z254.mender.domain.service.IncidentLifecycle#transition}, which never calls this.
     */
    void updateStatus(String id, IncidentStatus status);

    /**
     * Retrieve all incidents.
     */
    List<Incident> findAll();

    /**
     * Newest incident with the same service and error message created within {@code window} of now.
     */
    Optional<Incident> findDuplicate(String serviceName, String errorMessage, Duration window);

    Optional<Incident> findByWorkflowRunId(String workflowRunId);
}
