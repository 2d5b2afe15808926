package com.z254.mender.domain.repository;

import com.z254.mender.domain.model.IncidentEvent;

import java.util.List;

/**
 * Append-only audit trail storage.
 */
public interface IncidentEventRepository {

    /**
     * Append an event; the returned copy carries the assigned sequence id.
     */
    IncidentEvent append(IncidentEvent event);

    /**
     * Events for one incident in append order.
     */
    List<IncidentEvent> findByIncidentId(String incidentId);
}
