package com.z254.mender.observability;

import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.domain.model.WorkflowOutcome;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics for MENDER service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Incident intake (received, deduplicated, unroutable)</li>
 *     <li>Lifecycle transitions and time to resolution</li>
 *     <li>Workflow dispatch (attempts, outcomes, latency, queue depth)</li>
 *     <li>Routing configuration reloads</li>
 * </ul>
 */
@Component
public class MenderMetrics {

    private final MeterRegistry meterRegistry;

    // Intake metrics
    @Getter
    private final Counter incidentsReceived;
    @Getter
    private final Counter incidentsDeduplicated;
    @Getter
    private final Counter incidentsUnroutable;
    @Getter
    private final Counter incidentsSkipped;

    // Lifecycle metrics
    @Getter
    private final Counter incidentsResolved;
    private final Timer incidentMttr;
    private final Map<IncidentStatus, Counter> transitionsByStatus = new ConcurrentHashMap<>();
    private final Map<WorkflowOutcome, Counter> completionsByOutcome = new ConcurrentHashMap<>();

    // Dispatch metrics
    @Getter
    private final Counter dispatchAttempts;
    @Getter
    private final Counter dispatchSucceeded;
    @Getter
    private final Counter dispatchFailed;
    @Getter
    private final Counter dispatchQueued;
    private final Timer dispatchLatency;
    private final Map<String, Boolean> repositoryGauges = new ConcurrentHashMap<>();

    // Routing metrics
    @Getter
    private final Counter routingReloads;
    @Getter
    private final Counter routingReloadFailures;

    public MenderMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.incidentsReceived = Counter.builder("mender.incidents.received")
                .description("Normalized incidents received")
                .register(meterRegistry);
        this.incidentsDeduplicated = Counter.builder("mender.incidents.deduplicated")
                .description("Incidents collapsed into an existing incident")
                .register(meterRegistry);
        this.incidentsUnroutable = Counter.builder("mender.incidents.unroutable")
                .description("Incidents for services with no repository mapping")
                .register(meterRegistry);
        this.incidentsSkipped = Counter.builder("mender.incidents.skipped")
                .description("Incidents a routing rule excluded from remediation")
                .register(meterRegistry);

        this.incidentsResolved = Counter.builder("mender.incidents.resolved")
                .description("Incidents resolved after a merged fix")
                .register(meterRegistry);
        this.incidentMttr = Timer.builder("mender.incidents.mttr")
                .description("Time from incident creation to resolution")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);

        this.dispatchAttempts = Counter.builder("mender.dispatch.attempts")
                .description("Workflow dispatch transport attempts")
                .register(meterRegistry);
        this.dispatchSucceeded = Counter.builder("mender.dispatch.succeeded")
                .description("Workflows dispatched")
                .register(meterRegistry);
        this.dispatchFailed = Counter.builder("mender.dispatch.failed")
                .description("Dispatches that exhausted all attempts")
                .register(meterRegistry);
        this.dispatchQueued = Counter.builder("mender.dispatch.queued")
                .description("Incidents parked behind a repository ceiling")
                .register(meterRegistry);
        this.dispatchLatency = Timer.builder("mender.dispatch.latency")
                .description("Dispatch latency including retries")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.routingReloads = Counter.builder("mender.routing.reloads")
                .description("Successful routing configuration reloads")
                .register(meterRegistry);
        this.routingReloadFailures = Counter.builder("mender.routing.reload_failures")
                .description("Rejected routing configuration reloads")
                .register(meterRegistry);
    }

    // ========== Incident Methods ==========

    public void recordIncidentReceived() {
        incidentsReceived.increment();
    }

    public void recordIncidentDeduplicated() {
        incidentsDeduplicated.increment();
    }

    public void recordIncidentUnroutable() {
        incidentsUnroutable.increment();
    }

    public void recordIncidentSkipped() {
        incidentsSkipped.increment();
    }

    public void recordTransition(IncidentStatus target) {
        transitionsByStatus.computeIfAbsent(target, status ->
                Counter.builder("mender.incidents.transitions")
                        .tag("status", status.getValue())
                        .description("Lifecycle transitions by target status")
                        .register(meterRegistry))
                .increment();
    }

    public void recordCompletion(WorkflowOutcome outcome) {
        completionsByOutcome.computeIfAbsent(outcome, value ->
                Counter.builder("mender.workflows.completions")
                        .tag("outcome", value.getValue())
                        .description("Workflow completion callbacks by outcome")
                        .register(meterRegistry))
                .increment();
    }

    public void recordIncidentResolved(Duration timeToResolve) {
        incidentsResolved.increment();
        incidentMttr.record(timeToResolve);
    }

    // ========== Dispatch Methods ==========

    public Timer.Sample startDispatchTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordDispatchAttempt() {
        dispatchAttempts.increment();
    }

    public void recordDispatchSucceeded(Timer.Sample sample) {
        sample.stop(dispatchLatency);
        dispatchSucceeded.increment();
    }

    public void recordDispatchFailed(Timer.Sample sample) {
        sample.stop(dispatchLatency);
        dispatchFailed.increment();
    }

    public void recordDispatchQueued() {
        dispatchQueued.increment();
    }

    /**
     * Registers active and queued gauges for a repository the first time it is seen.
     */
    public void registerRepositoryGauges(String repository, Supplier<Number> active, Supplier<Number> queued) {
        repositoryGauges.computeIfAbsent(repository, repo -> {
            Gauge.builder("mender.dispatch.active", active)
                    .tag("repository", repo)
                    .description("Running remediation jobs")
                    .register(meterRegistry);
            Gauge.builder("mender.dispatch.backlog", queued)
                    .tag("repository", repo)
                    .description("Incidents waiting for a slot")
                    .register(meterRegistry);
            return Boolean.TRUE;
        });
    }

    // ========== Routing Methods ==========

    public void recordRoutingReload() {
        routingReloads.increment();
    }

    public void recordRoutingReloadFailure() {
        routingReloadFailures.increment();
    }
}
