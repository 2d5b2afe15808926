package com.z254.mender.dispatch;

import com.z254.mender.config.OrchestrationSettings;
import com.z254.mender.config.OrchestrationSettingsHolder;
import com.z254.mender.domain.exception.DispatchFailureException;
import com.z254.mender.domain.exception.DispatchTransportException;
import com.z254.mender.domain.exception.InvalidTransitionException;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.domain.repository.IncidentRepository;
import com.z254.mender.domain.service.IncidentAuditTrail;
import com.z254.mender.domain.service.IncidentLifecycle;
import com.z254.mender.observability.MenderMetrics;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.observability.MenderStructuredLogger.DispatchEventType;
import com.z254.mender.routing.RoutingTable;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admits incidents to their repository's dispatch slots and triggers the remediation job.
 * <p>
 * Transport calls are bounded by the configured timeout and retried with exponential backoff.
 * When every attempt fails the incident is marked failed and its slot goes to the next
 * queued incident.
 */
@Slf4j
@Service
public class RemediationDispatcher {

    private final DispatchQueueManager queueManager;
    private final DispatchTransport transport;
    private final IncidentRepository incidentRepository;
    private final IncidentLifecycle lifecycle;
    private final IncidentAuditTrail auditTrail;
    private final RoutingTable routingTable;
    private final OrchestrationSettingsHolder settingsHolder;
    private final MenderStructuredLogger structuredLogger;
    private final MenderMetrics metrics;
    private final Clock clock;

    public RemediationDispatcher(DispatchQueueManager queueManager,
                                 DispatchTransport transport,
                                 IncidentRepository incidentRepository,
                                 IncidentLifecycle lifecycle,
                                 IncidentAuditTrail auditTrail,
                                 RoutingTable routingTable,
                                 OrchestrationSettingsHolder settingsHolder,
                                 MenderStructuredLogger structuredLogger,
                                 MenderMetrics metrics,
                                 Clock clock) {
        this.queueManager = queueManager;
        this.transport = transport;
        this.incidentRepository = incidentRepository;
        this.lifecycle = lifecycle;
        this.auditTrail = auditTrail;
        this.routingTable = routingTable;
        this.settingsHolder = settingsHolder;
        this.structuredLogger = structuredLogger;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Admit a pending incident and dispatch it if a slot is free. An incident whose dispatch is
     * already in flight is returned as stored without a second transport call.
     *
     * @return the incident as stored after admission (and dispatch, when it happened)
     */
    public Mono<Incident> submit(Incident incident) {
        return Mono.defer(() -> {
            String repository = incident.getRepository();
            int ceiling = settingsHolder.current().maxConcurrencyFor(repository);
            AdmissionDecision decision = queueManager.admit(repository, incident, ceiling);
            if (decision != AdmissionDecision.DISPATCH_NOW) {
                return Mono.just(reload(incident));
            }
            return dispatchWithRetry(incident);
        });
    }

    /**
     * Whether a dispatch for the incident has been admitted and has no outcome yet.
     */
    public boolean isDispatching(String incidentId) {
        return queueManager.isDispatching(incidentId);
    }

    /**
     * Give back the repository's slot and dispatch the next queued incident that is still pending.
     */
    public Mono<Void> releaseAndAdvance(String repository) {
        return Mono.defer(() -> advance(repository, queueManager.release(repository)));
    }

    private Mono<Void> advance(String repository, Optional<Incident> next) {
        if (next.isEmpty()) {
            return Mono.empty();
        }
        Optional<Incident> current = incidentRepository.findById(next.get().getId());
        if (current.isEmpty() || current.get().getStatus() != IncidentStatus.PENDING) {
            log.info("Skipping queued incident {} that is no longer pending", next.get().getId());
            return Mono.defer(() -> advance(repository, queueManager.dequeue(repository)));
        }
        return submit(current.get()).then();
    }

    private Mono<Incident> dispatchWithRetry(Incident incident) {
        OrchestrationSettings settings = settingsHolder.current();
        DispatchRequest request = buildRequest(incident);
        AtomicInteger attempts = new AtomicInteger();
        Timer.Sample sample = metrics.startDispatchTimer();

        Mono<String> attempt = Mono.defer(() -> {
            attempts.incrementAndGet();
            metrics.recordDispatchAttempt();
            return transport.dispatch(request)
                    .switchIfEmpty(Mono.error(() -> new DispatchTransportException(
                            "Transport returned no run id for " + incident.getRepository(), -1)));
        })
                .timeout(settings.getDispatchTimeout())
                .doOnError(error -> structuredLogger.logDispatchEvent(incident.getRepository(), incident.getId(),
                        DispatchEventType.ATTEMPT_FAILED, "Dispatch attempt failed",
                        Map.of("attempt", attempts.get(), "error", describe(error))));

        return attempt
                .retryWhen(Retry.backoff(Math.max(0, settings.getMaxAttempts() - 1), settings.getInitialBackoff())
                        .jitter(0d)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(DispatchResult::dispatched)
                .onErrorResume(error -> Mono.just(DispatchResult.failed(error)))
                .flatMap(result -> result.succeeded()
                        ? onDispatched(incident, request, result.runId(), attempts.get(), sample)
                        : onExhausted(incident, result.error(), attempts.get(), sample))
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL && queueManager.dispatchFinished(incident.getId())) {
                        log.warn("Dispatch of incident {} cancelled before an outcome, releasing its slot",
                                incident.getId());
                        releaseAndAdvance(incident.getRepository()).subscribe(null, failure ->
                                log.error("Could not release slot of {}", incident.getRepository(), failure));
                    }
                });
    }

    private Mono<Incident> onDispatched(Incident incident, DispatchRequest request, String runId,
                                        int attempts, Timer.Sample sample) {
        metrics.recordDispatchSucceeded(sample);
        Incident triggered;
        try {
            triggered = lifecycle.transition(incident.getId(), IncidentStatus.WORKFLOW_TRIGGERED,
                    Map.of("run_id", runId), updated -> updated.setWorkflowRunId(runId));
        } catch (InvalidTransitionException e) {
            log.warn("Incident {} changed while its workflow was dispatched: {}", incident.getId(), e.getMessage());
            return releaseAndAdvance(incident.getRepository()).then(Mono.fromCallable(() -> reload(incident)));
        } catch (RuntimeException e) {
            log.error("Could not record run {} for incident {}, releasing its slot", runId, incident.getId(), e);
            return releaseAndAdvance(incident.getRepository()).then(Mono.error(e));
        } finally {
            queueManager.dispatchFinished(incident.getId());
        }

        auditTrail.record(incident.getId(), IncidentEventType.WORKFLOW_TRIGGERED, Map.of(
                "repository", incident.getRepository(),
                "branch", request.getBranch(),
                "run_id", runId,
                "attempts", attempts));
        structuredLogger.logDispatchEvent(incident.getRepository(), incident.getId(), DispatchEventType.DISPATCHED,
                "Remediation workflow triggered", Map.of("runId", runId, "attempts", attempts));
        return Mono.just(triggered);
    }

    private Mono<Incident> onExhausted(Incident incident, Throwable error, int attempts, Timer.Sample sample) {
        metrics.recordDispatchFailed(sample);
        DispatchFailureException failure = new DispatchFailureException(incident.getRepository(), attempts, error);
        structuredLogger.logDispatchEvent(incident.getRepository(), incident.getId(), DispatchEventType.EXHAUSTED,
                failure.getMessage(), Map.of("attempts", attempts));

        Map<String, Object> details = new HashMap<>();
        details.put("repository", incident.getRepository());
        details.put("attempts", attempts);
        details.put("error", describe(error));
        auditTrail.record(incident.getId(), IncidentEventType.DISPATCH_FAILED, details);

        try {
            lifecycle.transition(incident.getId(), IncidentStatus.FAILED, Map.of("reason", "dispatch_failed"));
        } catch (InvalidTransitionException e) {
            log.warn("Could not mark incident {} failed after dispatch exhaustion: {}",
                    incident.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark incident {} failed after dispatch exhaustion, releasing its slot",
                    incident.getId(), e);
            return releaseAndAdvance(incident.getRepository()).then(Mono.error(e));
        } finally {
            queueManager.dispatchFinished(incident.getId());
        }
        return releaseAndAdvance(incident.getRepository()).then(Mono.fromCallable(() -> reload(incident)));
    }

    private DispatchRequest buildRequest(Incident incident) {
        return DispatchRequest.builder()
                .dispatchId(UUID.randomUUID().toString())
                .incidentId(incident.getId())
                .repository(incident.getRepository())
                .branch(routingTable.branchFor(incident.getRepository()))
                .serviceName(incident.getServiceName())
                .errorMessage(incident.getErrorMessage())
                .stackTrace(incident.getStackTrace())
                .timestamp(clock.instant())
                .build();
    }

    private Incident reload(Incident incident) {
        return incidentRepository.findById(incident.getId()).orElse(incident);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record DispatchResult(String runId, Throwable error) {

        static DispatchResult dispatched(String runId) {
            return new DispatchResult(runId, null);
        }

        static DispatchResult failed(Throwable error) {
            return new DispatchResult(null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }
}
