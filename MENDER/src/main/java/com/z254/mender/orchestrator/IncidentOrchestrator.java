package com.z254.mender.orchestrator;

import com.z254.mender.config.OrchestrationSettings;
import com.z254.mender.config.OrchestrationSettingsHolder;
import com.z254.mender.dispatch.RemediationDispatcher;
import com.z254.mender.domain.exception.IncidentBusyException;
import com.z254.mender.domain.exception.IncidentNotFoundException;
import com.z254.mender.domain.exception.IncidentValidationException;
import com.z254.mender.domain.exception.InvalidTransitionException;
import com.z254.mender.domain.exception.UnroutableServiceException;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentEvent;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.domain.model.NormalizedIncident;
import com.z254.mender.domain.model.ServiceMapping;
import com.z254.mender.domain.model.WorkflowCompletion;
import com.z254.mender.domain.model.WorkflowOutcome;
import com.z254.mender.domain.repository.IncidentRepository;
import com.z254.mender.domain.service.IncidentAuditTrail;
import com.z254.mender.domain.service.IncidentDeduplicator;
import com.z254.mender.domain.service.IncidentLifecycle;
import com.z254.mender.observability.MenderMetrics;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.observability.MenderStructuredLogger.RoutingEventType;
import com.z254.mender.routing.RoutingRuleEngine;
import com.z254.mender.routing.RoutingTable;
import com.z254.mender.routing.RuleEvaluation;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Entry point for everything that happens to an incident.
 * <p>
 * Intake runs validation, routing rules, deduplication and routing before the incident is
 * persisted and handed to the {@link RemediationDispatcher}. Completion callbacks drive the
 * lifecycle forward and free the repository's dispatch slot for the next queued incident.
 */
@Slf4j
@Service
public class IncidentOrchestrator {

    static final String UNROUTABLE_SERVICE = "unroutable_service";

    private final IncidentRepository incidentRepository;
    private final IncidentLifecycle lifecycle;
    private final IncidentDeduplicator deduplicator;
    private final IncidentAuditTrail auditTrail;
    private final RoutingTable routingTable;
    private final RoutingRuleEngine ruleEngine;
    private final RemediationDispatcher dispatcher;
    private final OrchestrationSettingsHolder settingsHolder;
    private final Validator validator;
    private final MenderStructuredLogger structuredLogger;
    private final MenderMetrics metrics;
    private final Clock clock;

    public IncidentOrchestrator(IncidentRepository incidentRepository,
                                IncidentLifecycle lifecycle,
                                IncidentDeduplicator deduplicator,
                                IncidentAuditTrail auditTrail,
                                RoutingTable routingTable,
                                RoutingRuleEngine ruleEngine,
                                RemediationDispatcher dispatcher,
                                OrchestrationSettingsHolder settingsHolder,
                                Validator validator,
                                MenderStructuredLogger structuredLogger,
                                MenderMetrics metrics,
                                Clock clock) {
        this.incidentRepository = incidentRepository;
        this.lifecycle = lifecycle;
        this.deduplicator = deduplicator;
        this.auditTrail = auditTrail;
        this.routingTable = routingTable;
        this.ruleEngine = ruleEngine;
        this.dispatcher = dispatcher;
        this.settingsHolder = settingsHolder;
        this.validator = validator;
        this.structuredLogger = structuredLogger;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Intake ==========

    /**
     * Accept a normalized incident.
     *
     * @return the new incident, or the existing one when the report is a duplicate
     * @throws IncidentValidationException when required fields are missing; nothing is stored
     */
    public Mono<Incident> createIncident(NormalizedIncident incoming) {
        return Mono.defer(() -> {
            validate(incoming);
            metrics.recordIncidentReceived();

            RuleEvaluation rules = ruleEngine.evaluate(incoming);
            OrchestrationSettings settings = settingsHolder.current();

            Optional<Incident> duplicate = deduplicator.resolve(incoming, rules.severity(),
                    settings.getDeduplicationWindow());
            if (duplicate.isPresent()) {
                return Mono.just(duplicate.get());
            }

            Optional<String> repository = rules.repositoryOverride()
                    .or(() -> routingTable.lookup(incoming.getServiceName()).map(ServiceMapping::repository));
            Incident created = incidentRepository.create(buildIncident(incoming, rules, repository));

            Map<String, Object> received = new HashMap<>();
            received.put("service", created.getServiceName());
            received.put("repository", created.getRepository());
            received.put("provider", created.getProvider());
            received.put("severity", String.valueOf(created.getSeverity()));
            if (rules.hasMatches()) {
                received.put("matched_rules", String.join(",", rules.matchedRules()));
            }
            if (rules.skipRemediation()) {
                received.put("skip_remediation", true);
            }
            auditTrail.record(created.getId(), IncidentEventType.INCIDENT_RECEIVED, received);

            if (repository.isEmpty()) {
                metrics.recordIncidentUnroutable();
                auditTrail.record(created.getId(), IncidentEventType.INCIDENT_FAILED,
                        Map.of("reason", UNROUTABLE_SERVICE, "service", created.getServiceName()));
                structuredLogger.logRoutingEvent(RoutingEventType.UNROUTABLE, "No repository mapped for service",
                        Map.of("service", created.getServiceName(), "incidentId", created.getId()));
                return Mono.just(created);
            }
            if (rules.skipRemediation()) {
                metrics.recordIncidentSkipped();
                log.info("Remediation skipped by routing rule for incident {}", created.getId());
                return Mono.just(created);
            }
            return dispatcher.submit(created);
        });
    }

    // ========== Workflow callbacks ==========

    /**
     * Apply a completion signal from the remediation workflow. Signals for incidents that are
     * not running a job are ignored.
     */
    public Mono<Incident> onWorkflowCompletion(WorkflowCompletion completion) {
        return Mono.defer(() -> {
            if (completion == null || completion.getOutcome() == null) {
                throw new IncidentValidationException(List.of("outcome is required"));
            }
            Incident incident = locate(completion);
            metrics.recordCompletion(completion.getOutcome());
            if (!incident.isDispatchActive()) {
                log.info("Ignoring {} callback for incident {} in status {}",
                        completion.getOutcome(), incident.getId(), incident.getStatus());
                return Mono.just(incident);
            }

            Incident updated;
            try {
                updated = applyOutcome(incident, completion);
            } catch (InvalidTransitionException e) {
                log.info("Ignoring stale {} callback for incident {}: {}",
                        completion.getOutcome(), incident.getId(), e.getMessage());
                return Mono.fromCallable(() -> load(incident.getId()));
            }
            if (updated.isDispatchActive()) {
                return Mono.just(updated);
            }
            return dispatcher.releaseAndAdvance(updated.getRepository())
                    .then(Mono.fromCallable(() -> load(updated.getId())));
        });
    }

    private Incident applyOutcome(Incident incident, WorkflowCompletion completion) {
        String id = incident.getId();
        Consumer<Incident> recordOutcome = target -> {
            if (completion.getDiagnosis() != null) {
                target.setDiagnosis(completion.getDiagnosis());
            }
            if (completion.hasPullRequest()) {
                target.setPullRequestUrl(completion.getPullRequestUrl());
            }
            if (target.getWorkflowRunId() == null && completion.getRunId() != null) {
                target.setWorkflowRunId(completion.getRunId());
            }
        };

        WorkflowOutcome outcome = completion.getOutcome();
        switch (outcome) {
            case IN_PROGRESS -> {
                return markInProgress(incident, completion);
            }
            case SUCCESS, NO_FIX_NEEDED -> {
                markInProgress(incident, completion);
                if (outcome == WorkflowOutcome.SUCCESS && completion.hasPullRequest()) {
                    Incident prCreated = lifecycle.transition(id, IncidentStatus.PR_CREATED,
                            Map.of("outcome", outcome.getValue()), recordOutcome);
                    auditTrail.record(id, IncidentEventType.PR_CREATED,
                            Map.of("pr_url", completion.getPullRequestUrl()));
                    return prCreated;
                }
                return lifecycle.transition(id, IncidentStatus.NO_FIX_NEEDED,
                        Map.of("outcome", outcome.getValue()), recordOutcome);
            }
            case FAILED -> {
                Incident failed = lifecycle.transition(id, IncidentStatus.FAILED,
                        Map.of("outcome", outcome.getValue()), recordOutcome);
                Map<String, Object> details = new HashMap<>();
                details.put("reason", "workflow_failed");
                if (completion.getDiagnosis() != null) {
                    details.put("diagnosis", completion.getDiagnosis());
                }
                auditTrail.record(id, IncidentEventType.INCIDENT_FAILED, details);
                return failed;
            }
            default -> throw new IllegalStateException("Unhandled workflow outcome " + outcome);
        }
    }

    private Incident markInProgress(Incident incident, WorkflowCompletion completion) {
        if (incident.getStatus() != IncidentStatus.WORKFLOW_TRIGGERED) {
            return incident;
        }
        Incident inProgress = lifecycle.transition(incident.getId(), IncidentStatus.IN_PROGRESS, Map.of());
        Map<String, Object> details = new HashMap<>();
        details.put("repository", incident.getRepository());
        if (completion.getRunId() != null) {
            details.put("run_id", completion.getRunId());
        }
        auditTrail.record(incident.getId(), IncidentEventType.WORKFLOW_IN_PROGRESS, details);
        return inProgress;
    }

    private Incident locate(WorkflowCompletion completion) {
        if (completion.getIncidentId() != null && !completion.getIncidentId().isBlank()) {
            return load(completion.getIncidentId());
        }
        if (completion.getRunId() != null && !completion.getRunId().isBlank()) {
            return incidentRepository.findByWorkflowRunId(completion.getRunId())
                    .orElseThrow(() -> new IncidentNotFoundException("run " + completion.getRunId()));
        }
        throw new IncidentValidationException(List.of("incidentId or runId is required"));
    }

    // ========== Operator actions ==========

    /**
     * Re-enter a pending or failed incident into dispatch.
     *
     * @throws IncidentBusyException        when a job is running or being dispatched for the incident
     * @throws UnroutableServiceException   when a failed unroutable incident still has no mapping
     * @throws InvalidTransitionException   for any other status
     */
    public Mono<Incident> manualTrigger(String incidentId) {
        return Mono.defer(() -> {
            Incident incident = load(incidentId);
            IncidentStatus previous = incident.getStatus();
            if (incident.isDispatchActive() || dispatcher.isDispatching(incidentId)) {
                throw new IncidentBusyException(incidentId, previous);
            }

            Incident ready = switch (previous) {
                case PENDING -> incident;
                case FAILED -> {
                    if (!incident.isRouted()) {
                        ServiceMapping mapping = routingTable.lookup(incident.getServiceName())
                                .orElseThrow(() -> new UnroutableServiceException(incident.getServiceName()));
                        lifecycle.amend(incidentId, target -> target.setRepository(mapping.repository()));
                    }
                    yield lifecycle.transition(incidentId, IncidentStatus.PENDING, Map.of("reason", "manual_trigger"));
                }
                default -> throw new InvalidTransitionException(incidentId, previous, IncidentStatus.PENDING);
            };

            auditTrail.record(incidentId, IncidentEventType.MANUAL_TRIGGER, Map.of(
                    "previous_status", previous.getValue(),
                    "repository", ready.getRepository()));
            return dispatcher.submit(ready);
        });
    }

    /**
     * Mark the fix proposed by a pull request as merged.
     */
    public Mono<Incident> resolveIncident(String incidentId) {
        return Mono.fromCallable(() -> {
            Incident resolved = lifecycle.transition(incidentId, IncidentStatus.RESOLVED, Map.of());
            Map<String, Object> details = new HashMap<>();
            if (resolved.getPullRequestUrl() != null) {
                details.put("pr_url", resolved.getPullRequestUrl());
            }
            auditTrail.record(incidentId, IncidentEventType.INCIDENT_RESOLVED, details);
            metrics.recordIncidentResolved(Duration.between(resolved.getCreatedAt(), resolved.getCompletedAt()));
            return resolved;
        });
    }

    // ========== Queries ==========

    public Mono<Incident> getIncident(String incidentId) {
        return Mono.fromCallable(() -> load(incidentId));
    }

    /**
     * Incidents newest first, optionally filtered by status and service.
     */
    public Mono<List<Incident>> listIncidents(IncidentStatus status, String serviceName) {
        return Mono.fromCallable(() -> incidentRepository.findAll().stream()
                .filter(incident -> status == null || incident.getStatus() == status)
                .filter(incident -> serviceName == null || serviceName.equals(incident.getServiceName()))
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .toList());
    }

    public Mono<List<IncidentEvent>> getEvents(String incidentId) {
        return Mono.fromCallable(() -> {
            load(incidentId);
            return auditTrail.eventsFor(incidentId);
        });
    }

    // ========== Helpers ==========

    private void validate(NormalizedIncident incoming) {
        if (incoming == null) {
            throw new IncidentValidationException(List.of("incident body is required"));
        }
        Set<ConstraintViolation<NormalizedIncident>> violations = validator.validate(incoming);
        if (!violations.isEmpty()) {
            throw new IncidentValidationException(violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .sorted()
                    .toList());
        }
    }

    private Incident buildIncident(NormalizedIncident incoming, RuleEvaluation rules, Optional<String> repository) {
        Instant now = clock.instant();
        Map<String, Object> providerData = new HashMap<>();
        if (incoming.getProviderData() != null) {
            providerData.putAll(incoming.getProviderData());
        }
        providerData.putAll(rules.metadata());

        Incident.IncidentBuilder builder = Incident.builder()
                .id(incoming.getId() != null && !incoming.getId().isBlank()
                        ? incoming.getId()
                        : "INC-" + UUID.randomUUID())
                .serviceName(incoming.getServiceName())
                .repository(repository.orElse(""))
                .errorMessage(incoming.getErrorMessage())
                .stackTrace(incoming.getStackTrace())
                .severity(rules.severity())
                .provider(incoming.getProvider())
                .providerData(providerData)
                .createdAt(now)
                .updatedAt(now);

        if (repository.isEmpty()) {
            builder.status(IncidentStatus.FAILED).completedAt(now);
        } else {
            builder.status(IncidentStatus.PENDING);
        }
        return builder.build();
    }

    private Incident load(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }
}
