package com.z254.mender.domain.service;

import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.model.NormalizedIncident;
import com.z254.mender.domain.repository.IncidentRepository;
import com.z254.mender.observability.MenderMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Collapses repeated reports of the same error from the same service into one incident.
 * <p>
 * Two reports match when service name and error message are identical and the existing
 * incident was created within the window. The check and the later create are not atomic,
 * so two truly simultaneous reports may both create an incident.
 */
@Slf4j
@Service
public class IncidentDeduplicator {

    private final IncidentRepository incidentRepository;
    private final IncidentLifecycle lifecycle;
    private final IncidentAuditTrail auditTrail;
    private final MenderMetrics metrics;

    public IncidentDeduplicator(IncidentRepository incidentRepository,
                                IncidentLifecycle lifecycle,
                                IncidentAuditTrail auditTrail,
                                MenderMetrics metrics) {
        this.incidentRepository = incidentRepository;
        this.lifecycle = lifecycle;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
    }

    /**
     * @return the existing incident, refreshed, when {@code incoming} is a duplicate
     */
    public Optional<Incident> resolve(NormalizedIncident incoming, String severity, Duration window) {
        Optional<Incident> match = incidentRepository.findDuplicate(
                incoming.getServiceName(), incoming.getErrorMessage(), window);
        if (match.isEmpty()) {
            return Optional.empty();
        }

        Incident existing = lifecycle.amend(match.get().getId(), incident -> { });

        Map<String, Object> details = new HashMap<>();
        details.put("provider", incoming.getProvider());
        details.put("severity", severity);
        if (incoming.getId() != null) {
            details.put("source_id", incoming.getId());
        }
        auditTrail.record(existing.getId(), IncidentEventType.DUPLICATE_DETECTED, details);
        metrics.recordIncidentDeduplicated();

        log.debug("Incident from {} collapsed into {}", incoming.getServiceName(), existing.getId());
        return Optional.of(existing);
    }
}
