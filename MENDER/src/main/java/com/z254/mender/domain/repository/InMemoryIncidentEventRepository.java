package com.z254.mender.domain.repository;

import com.z254.mender.domain.model.IncidentEvent;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryIncidentEventRepository implements IncidentEventRepository {

    private final Map<String, List<IncidentEvent>> eventsByIncident = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public IncidentEvent append(IncidentEvent event) {
        IncidentEvent stored = IncidentEvent.builder()
                .id(sequence.incrementAndGet())
                .incidentId(event.getIncidentId())
                .eventType(event.getEventType())
                .details(event.getDetails() != null ? new HashMap<>(event.getDetails()) : new HashMap<>())
                .createdAt(event.getCreatedAt())
                .build();
        eventsByIncident.computeIfAbsent(stored.getIncidentId(), id -> new CopyOnWriteArrayList<>()).add(stored);
        return stored;
    }

    @Override
    public List<IncidentEvent> findByIncidentId(String incidentId) {
        return List.copyOf(eventsByIncident.getOrDefault(incidentId, List.of()));
    }
}
