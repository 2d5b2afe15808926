package com.z254.mender.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Append-only audit record for an incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentEvent {

    /** Sequence assigned by the event store */
    private long id;

    private String incidentId;

    private IncidentEventType eventType;

    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    private Instant createdAt;
}
