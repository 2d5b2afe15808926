package com.z254.mender.domain.service;

import com.z254.mender.domain.model.IncidentEvent;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.repository.IncidentEventRepository;
import com.z254.mender.observability.MenderStructuredLogger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends audit events and mirrors them to the structured log.
 */
@Component
public class IncidentAuditTrail {

    private final IncidentEventRepository eventRepository;
    private final MenderStructuredLogger structuredLogger;
    private final Clock clock;

    public IncidentAuditTrail(IncidentEventRepository eventRepository,
                              MenderStructuredLogger structuredLogger,
                              Clock clock) {
        this.eventRepository = eventRepository;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    public IncidentEvent record(String incidentId, IncidentEventType type, Map<String, Object> details) {
        Map<String, Object> copy = details != null ? new HashMap<>(details) : new HashMap<>();
        IncidentEvent event = eventRepository.append(IncidentEvent.builder()
                .incidentId(incidentId)
                .eventType(type)
                .details(copy)
                .createdAt(clock.instant())
                .build());
        structuredLogger.logIncidentEvent(incidentId, type, "Incident event " + type, copy);
        return event;
    }

    public List<IncidentEvent> eventsFor(String incidentId) {
        return eventRepository.findByIncidentId(incidentId);
    }
}
