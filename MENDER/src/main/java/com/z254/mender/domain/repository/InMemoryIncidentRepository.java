package com.z254.mender.domain.repository;

import com.z254.mender.domain.exception.ConcurrentIncidentUpdateException;
import com.z254.mender.domain.exception.IncidentNotFoundException;
import com.z254.mender.domain.exception.IncidentStoreException;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentStatus;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory incident store used until a durable store is wired up.
 */
@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private final Map<String, Incident> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIncidentRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Incident create(Incident incident) {
        Incident stored = incident.copy();
        stored.setVersion(0);
        if (store.putIfAbsent(stored.getId(), stored) != null) {
            throw new IncidentStoreException("Incident already exists: " + incident.getId());
        }
        return stored.copy();
    }

    @Override
    public Optional<Incident> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(Incident::copy);
    }

    @Override
    public Incident update(Incident incident) {
        Incident updated = store.compute(incident.getId(), (id, existing) -> {
            if (existing == null) {
                throw new IncidentNotFoundException(id);
            }
            if (existing.getVersion() != incident.getVersion()) {
                throw new ConcurrentIncidentUpdateException(id, incident.getVersion(), existing.getVersion());
            }
            Incident next = incident.copy();
            next.setVersion(existing.getVersion() + 1);
            return next;
        });
        return updated.copy();
    }

    @Override
    public void updateStatus(String id, IncidentStatus status) {
        Incident updated = store.computeIfPresent(id, (key, existing) -> {
            Incident next = existing.copy();
            next.setStatus(status);
            next.setUpdatedAt(clock.instant());
            next.setVersion(existing.getVersion() + 1);
            return next;
        });
        if (updated == null) {
            throw new IncidentNotFoundException(id);
        }
    }

    @Override
    public List<Incident> findAll() {
        return store.values().stream()
                .map(Incident::copy)
                .toList();
    }

    @Override
    public Optional<Incident> findDuplicate(String serviceName, String errorMessage, Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return store.values().stream()
                .filter(incident -> Objects.equals(incident.getServiceName(), serviceName))
                .filter(incident -> Objects.equals(incident.getErrorMessage(), errorMessage))
                .filter(incident -> incident.getCreatedAt() != null && incident.getCreatedAt().isAfter(cutoff))
                .max(Comparator.comparing(Incident::getCreatedAt))
                .map(Incident::copy);
    }

    @Override
    public Optional<Incident> findByWorkflowRunId(String workflowRunId) {
        if (workflowRunId == null) {
            return Optional.empty();
        }
        return store.values().stream()
                .filter(incident -> workflowRunId.equals(incident.getWorkflowRunId()))
                .findFirst()
                .map(Incident::copy);
    }
}
