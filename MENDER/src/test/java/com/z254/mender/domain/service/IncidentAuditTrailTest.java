package com.z254.mender.domain.service;

import com.z254.mender.domain.model.IncidentEvent;
import com.z254.mender.domain.model.IncidentEventType;
import com.z254.mender.domain.repository.IncidentEventRepository;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IncidentAuditTrailTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private IncidentEventRepository eventRepository;

    @Mock
    private MenderStructuredLogger structuredLogger;

    private IncidentAuditTrail auditTrail;

    @BeforeEach
    void setUp() {
        auditTrail = new IncidentAuditTrail(eventRepository, structuredLogger, new MutableClock(NOW));
    }

    @Test
    void recordStampsTimeAndCopiesDetails() {
        when(eventRepository.append(any())).thenAnswer(invocation -> invocation.getArgument(0));
        Map<String, Object> details = new HashMap<>(Map.of("reason", "workflow_failed"));

        auditTrail.record("INC-1", IncidentEventType.INCIDENT_FAILED, details);
        details.put("reason", "changed later");

        ArgumentCaptor<IncidentEvent> captor = ArgumentCaptor.forClass(IncidentEvent.class);
        verify(eventRepository).append(captor.capture());
        IncidentEvent stored = captor.getValue();
        assertThat(stored.getIncidentId()).isEqualTo("INC-1");
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
        assertThat(stored.getDetails()).containsEntry("reason", "workflow_failed");
        verify(structuredLogger).logIncidentEvent(eq("INC-1"), eq(IncidentEventType.INCIDENT_FAILED),
                anyString(), anyMap());
    }

    @Test
    void nullDetailsBecomeEmpty() {
        when(eventRepository.append(any())).thenAnswer(invocation -> invocation.getArgument(0));

        IncidentEvent event = auditTrail.record("INC-1", IncidentEventType.MANUAL_TRIGGER, null);

        assertThat(event.getDetails()).isEmpty();
    }
}
