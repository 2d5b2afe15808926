package com.z254.mender.domain.service;

import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentEvent;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.model.NormalizedIncident;
import com.z254.mender.support.MenderTestFixture;
import com.z254.mender.support.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentDeduplicatorTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);

    private MenderTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new MenderTestFixture(new ScriptedTransport());
        fixture.incidentRepository.create(Incident.builder()
                .id("INC-1")
                .serviceName("checkout")
                .repository("acme/checkout")
                .errorMessage("NullPointerException in CartService")
                .provider("sentry")
                .createdAt(fixture.clock.instant())
                .updatedAt(fixture.clock.instant())
                .build());
    }

    @Test
    void matchRefreshesExistingIncidentAndRecordsEvent() {
        fixture.clock.advance(Duration.ofSeconds(10));

        Optional<Incident> result = fixture.deduplicator.resolve(incoming("checkout"), "high", WINDOW);

        assertThat(result).isPresent();
        assertThat(result.get().getId()).isEqualTo("INC-1");
        assertThat(result.get().getUpdatedAt()).isEqualTo(fixture.clock.instant());

        List<IncidentEvent> events = fixture.eventRepository.findByIncidentId("INC-1");
        assertThat(events).extracting(IncidentEvent::getEventType)
                .containsExactly(IncidentEventType.DUPLICATE_DETECTED);
        assertThat(events.get(0).getDetails())
                .containsEntry("provider", "datadog")
                .containsEntry("severity", "high");
        assertThat(fixture.metrics.getIncidentsDeduplicated().count()).isEqualTo(1.0);
    }

    @Test
    void differentServiceIsNotDuplicate() {
        assertThat(fixture.deduplicator.resolve(incoming("payments"), "high", WINDOW)).isEmpty();
        assertThat(fixture.eventTypes("INC-1")).isEmpty();
    }

    @Test
    void expiredWindowIsNotDuplicate() {
        fixture.clock.advance(Duration.ofMinutes(6));

        assertThat(fixture.deduplicator.resolve(incoming("checkout"), "high", WINDOW)).isEmpty();
    }

    private NormalizedIncident incoming(String service) {
        return NormalizedIncident.builder()
                .serviceName(service)
                .errorMessage("NullPointerException in CartService")
                .severity("high")
                .provider("datadog")
                .build();
    }
}
