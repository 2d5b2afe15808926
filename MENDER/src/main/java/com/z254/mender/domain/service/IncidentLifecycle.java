package com.z254.mender.domain.service;

import com.z254.mender.domain.exception.ConcurrentIncidentUpdateException;
import com.z254.mender.domain.exception.IncidentNotFoundException;
import com.z254.mender.domain.exception.InvalidTransitionException;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.domain.repository.IncidentRepository;
import com.z254.mender.observability.MenderMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Gate for every status change after an incident is created.
 * <p>
 * Each call re-reads the incident, validates the move against {@link IncidentStatus}'s
 * transition table and writes it back under the store's version check. When another writer
 * got there first the call re-reads and re-validates, so concurrent transitions never
 * overwrite each other: the loser either applies on top of the new state or fails with
 * {@link InvalidTransitionException}.
 */
@Slf4j
@Service
public class IncidentLifecycle {

    static final int MAX_WRITE_ATTEMPTS = 5;

    private final IncidentRepository incidentRepository;
    private final IncidentAuditTrail auditTrail;
    private final MenderMetrics metrics;
    private final Clock clock;

    public IncidentLifecycle(IncidentRepository incidentRepository,
                             IncidentAuditTrail auditTrail,
                             MenderMetrics metrics,
                             Clock clock) {
        this.incidentRepository = incidentRepository;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Incident transition(String incidentId, IncidentStatus target, Map<String, Object> details) {
        return transition(incidentId, target, details, null);
    }

    /**
     * Move an incident to {@code target}.
     *
     * @param details  extra fields for the {@code status_changed} event
     * @param mutation applied to the incident alongside the status change, may be null
     * @return the stored incident
     * @throws InvalidTransitionException if the move is not allowed from the current status
     * @throws IncidentNotFoundException  if the incident does not exist
     */
    public Incident transition(String incidentId, IncidentStatus target, Map<String, Object> details,
                               Consumer<Incident> mutation) {
        for (int attempt = 1; ; attempt++) {
            Incident incident = load(incidentId);
            IncidentStatus from = incident.getStatus();
            if (!from.canTransitionTo(target)) {
                throw new InvalidTransitionException(incidentId, from, target);
            }

            Instant now = clock.instant();
            incident.setStatus(target);
            incident.setUpdatedAt(now);
            if (target == IncidentStatus.WORKFLOW_TRIGGERED && incident.getTriggeredAt() == null) {
                incident.setTriggeredAt(now);
            }
            if (target.isCompletion() && incident.getCompletedAt() == null) {
                incident.setCompletedAt(now);
            }
            if (mutation != null) {
                mutation.accept(incident);
            }

            Incident stored;
            try {
                stored = incidentRepository.update(incident);
            } catch (ConcurrentIncidentUpdateException e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Retrying transition of {} to {} after concurrent update", incidentId, target);
                continue;
            }

            Map<String, Object> eventDetails = new HashMap<>();
            if (details != null) {
                eventDetails.putAll(details);
            }
            eventDetails.put("from", from.getValue());
            eventDetails.put("to", target.getValue());
            auditTrail.record(incidentId, IncidentEventType.STATUS_CHANGED, eventDetails);
            metrics.recordTransition(target);
            return stored;
        }
    }

    /**
     * Apply a non-status change (refresh, outcome fields, repository) under the same
     * version check, bumping {@code updatedAt}.
     */
    public Incident amend(String incidentId, Consumer<Incident> mutation) {
        for (int attempt = 1; ; attempt++) {
            Incident incident = load(incidentId);
            IncidentStatus status = incident.getStatus();
            mutation.accept(incident);
            incident.setStatus(status);
            incident.setUpdatedAt(clock.instant());
            try {
                return incidentRepository.update(incident);
            } catch (ConcurrentIncidentUpdateException e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Retrying amendment of {} after concurrent update", incidentId);
            }
        }
    }

    private Incident load(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }
}
