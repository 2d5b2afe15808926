package com.z254.mender.dispatch;

import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.service.IncidentAuditTrail;
import com.z254.mender.observability.MenderMetrics;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.observability.MenderStructuredLogger.DispatchEventType;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link DispatchQueueManager}. A single lock guards the whole repository map;
 * audit events and logs are written after the lock is released.
 */
@Component
public class InMemoryDispatchQueueManager implements DispatchQueueManager {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RepositoryState> repositories = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();

    private final IncidentAuditTrail auditTrail;
    private final MenderStructuredLogger structuredLogger;
    private final MenderMetrics metrics;

    public InMemoryDispatchQueueManager(IncidentAuditTrail auditTrail,
                                        MenderStructuredLogger structuredLogger,
                                        MenderMetrics metrics) {
        this.auditTrail = auditTrail;
        this.structuredLogger = structuredLogger;
        this.metrics = metrics;
    }

    @Override
    public AdmissionDecision admit(String repository, Incident incident, int maxConcurrency) {
        int ceiling = Math.max(1, maxConcurrency);
        int active;
        int position;
        boolean alreadyQueued = false;

        lock.lock();
        try {
            RepositoryState state = stateFor(repository);
            if (inFlight.contains(incident.getId())) {
                active = state.active;
                position = -1;
            } else if (state.active < ceiling) {
                state.active++;
                inFlight.add(incident.getId());
                active = state.active;
                position = 0;
            } else {
                active = state.active;
                position = state.positionOf(incident.getId());
                if (position > 0) {
                    alreadyQueued = true;
                } else {
                    state.queue.addLast(incident.copy());
                    position = state.queue.size();
                }
            }
        } finally {
            lock.unlock();
        }

        if (position < 0) {
            structuredLogger.logDispatchEvent(repository, incident.getId(), DispatchEventType.IN_FLIGHT,
                    "Dispatch already in flight, no slot taken", Map.of("active", active));
            return AdmissionDecision.IN_FLIGHT;
        }
        if (position == 0) {
            structuredLogger.logDispatchEvent(repository, incident.getId(), DispatchEventType.ADMITTED,
                    "Dispatch slot taken", Map.of("active", active, "maxConcurrency", ceiling));
            return AdmissionDecision.DISPATCH_NOW;
        }
        if (!alreadyQueued) {
            metrics.recordDispatchQueued();
            auditTrail.record(incident.getId(), IncidentEventType.QUEUED_FOR_REMEDIATION,
                    Map.of("repository", repository, "position", position));
            structuredLogger.logDispatchEvent(repository, incident.getId(), DispatchEventType.QUEUED,
                    "Repository at capacity, incident queued",
                    Map.of("active", active, "maxConcurrency", ceiling, "position", position));
        }
        return AdmissionDecision.QUEUED;
    }

    @Override
    public boolean isDispatching(String incidentId) {
        lock.lock();
        try {
            return inFlight.contains(incidentId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean dispatchFinished(String incidentId) {
        lock.lock();
        try {
            return inFlight.remove(incidentId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Incident> release(String repository) {
        boolean underflow;
        int active;
        Incident next;

        lock.lock();
        try {
            RepositoryState state = stateFor(repository);
            underflow = state.active == 0;
            if (!underflow) {
                state.active--;
            }
            active = state.active;
            next = state.queue.pollFirst();
        } finally {
            lock.unlock();
        }

        if (underflow) {
            structuredLogger.logDispatchEvent(repository, null, DispatchEventType.UNDERFLOW,
                    "Release with no running jobs", Map.of("active", 0));
        } else {
            structuredLogger.logDispatchEvent(repository, null, DispatchEventType.RELEASED,
                    "Dispatch slot released", Map.of("active", active));
        }
        return dequeued(repository, next);
    }

    @Override
    public Optional<Incident> dequeue(String repository) {
        Incident next;
        lock.lock();
        try {
            next = stateFor(repository).queue.pollFirst();
        } finally {
            lock.unlock();
        }
        return dequeued(repository, next);
    }

    @Override
    public int activeCount(String repository) {
        lock.lock();
        try {
            RepositoryState state = repositories.get(repository);
            return state != null ? state.active : 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int queuedCount(String repository) {
        lock.lock();
        try {
            RepositoryState state = repositories.get(repository);
            return state != null ? state.queue.size() : 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, RepositoryDispatchState> snapshot() {
        lock.lock();
        try {
            Map<String, RepositoryDispatchState> result = new TreeMap<>();
            repositories.forEach((repository, state) -> result.put(repository, state.toView(repository)));
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void restoreActive(String repository, int count) {
        lock.lock();
        try {
            stateFor(repository).active = Math.max(0, count);
        } finally {
            lock.unlock();
        }
        structuredLogger.logDispatchEvent(repository, null, DispatchEventType.RECONCILED,
                "Running job count restored", Map.of("active", Math.max(0, count)));
    }

    private Optional<Incident> dequeued(String repository, Incident next) {
        if (next == null) {
            return Optional.empty();
        }
        auditTrail.record(next.getId(), IncidentEventType.DEQUEUED_FOR_REMEDIATION,
                Map.of("repository", repository));
        structuredLogger.logDispatchEvent(repository, next.getId(), DispatchEventType.DEQUEUED,
                "Queued incident released for dispatch", null);
        return Optional.of(next);
    }

    private RepositoryState stateFor(String repository) {
        return repositories.computeIfAbsent(repository, repo -> {
            metrics.registerRepositoryGauges(repo,
                    () -> activeCount(repo),
                    () -> queuedCount(repo));
            return new RepositoryState();
        });
    }

    private static final class RepositoryState {
        private int active;
        private final Deque<Incident> queue = new ArrayDeque<>();

        /**
         * 1-based position of the incident in the queue, 0 if absent.
         */
        int positionOf(String incidentId) {
            int position = 1;
            for (Incident queued : queue) {
                if (queued.getId().equals(incidentId)) {
                    return position;
                }
                position++;
            }
            return 0;
        }

        RepositoryDispatchState toView(String repository) {
            return new RepositoryDispatchState(repository, active,
                    queue.stream().map(Incident::getId).toList());
        }
    }
}
