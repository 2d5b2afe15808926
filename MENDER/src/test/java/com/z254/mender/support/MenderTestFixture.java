package com.z254.mender.support;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.config.OrchestrationSettingsHolder;
import com.z254.mender.dispatch.DispatchTransport;
import com.z254.mender.dispatch.InMemoryDispatchQueueManager;
import com.z254.mender.dispatch.RemediationDispatcher;
import com.z254.mender.domain.model.IncidentEvent;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.repository.InMemoryIncidentEventRepository;
import com.z254.mender.domain.repository.InMemoryIncidentRepository;
import com.z254.mender.domain.service.IncidentAuditTrail;
import com.z254.mender.domain.service.IncidentDeduplicator;
import com.z254.mender.domain.service.IncidentLifecycle;
import com.z254.mender.observability.MenderMetrics;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.orchestrator.IncidentOrchestrator;
import com.z254.mender.routing.RoutingRuleEngine;
import com.z254.mender.routing.RoutingTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Wires the orchestration engine with in-memory stores, a test clock and a given transport.
 */
public class MenderTestFixture {

    public static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final MenderProperties properties = new MenderProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MenderMetrics metrics = new MenderMetrics(meterRegistry);
    public final MenderStructuredLogger structuredLogger = new MenderStructuredLogger();
    public final InMemoryIncidentRepository incidentRepository = new InMemoryIncidentRepository(clock);
    public final InMemoryIncidentEventRepository eventRepository = new InMemoryIncidentEventRepository();
    public final IncidentAuditTrail auditTrail = new IncidentAuditTrail(eventRepository, structuredLogger, clock);
    public final IncidentLifecycle lifecycle = new IncidentLifecycle(incidentRepository, auditTrail, metrics, clock);
    public final IncidentDeduplicator deduplicator =
            new IncidentDeduplicator(incidentRepository, lifecycle, auditTrail, metrics);
    public final RoutingTable routingTable;
    public final RoutingRuleEngine ruleEngine;
    public final OrchestrationSettingsHolder settingsHolder;
    public final InMemoryDispatchQueueManager queueManager;
    public final RemediationDispatcher dispatcher;
    public final IncidentOrchestrator orchestrator;

    public MenderTestFixture(DispatchTransport transport) {
        this(transport, properties -> { });
    }

    public MenderTestFixture(DispatchTransport transport, Consumer<MenderProperties> customizer) {
        properties.getDispatch().setInitialBackoff(Duration.ofMillis(1));
        properties.getDispatch().setTimeout(Duration.ofSeconds(2));
        customizer.accept(properties);

        routingTable = new RoutingTable(properties, structuredLogger);
        ruleEngine = new RoutingRuleEngine(properties, structuredLogger);
        settingsHolder = new OrchestrationSettingsHolder(properties);
        queueManager = new InMemoryDispatchQueueManager(auditTrail, structuredLogger, metrics);
        dispatcher = new RemediationDispatcher(queueManager, transport, incidentRepository, lifecycle,
                auditTrail, routingTable, settingsHolder, structuredLogger, metrics, clock);
        orchestrator = new IncidentOrchestrator(incidentRepository, lifecycle, deduplicator, auditTrail,
                routingTable, ruleEngine, dispatcher, settingsHolder,
                Validation.buildDefaultValidatorFactory().getValidator(), structuredLogger, metrics, clock);
    }

    public static MenderProperties.Routing.Mapping mapping(String service, String repository) {
        MenderProperties.Routing.Mapping mapping = new MenderProperties.Routing.Mapping();
        mapping.setServiceName(service);
        mapping.setRepository(repository);
        return mapping;
    }

    public List<IncidentEventType> eventTypes(String incidentId) {
        return eventRepository.findByIncidentId(incidentId).stream()
                .map(IncidentEvent::getEventType)
                .toList();
    }
}
