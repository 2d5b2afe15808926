package com.z254.mender.dispatch;

import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.support.MenderTestFixture;
import com.z254.mender.support.ScriptedTransport;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchStateReconcilerTest {

    @Test
    void restoresActiveCountsFromRunningIncidents() {
        MenderTestFixture fixture = new MenderTestFixture(new ScriptedTransport());
        store(fixture, "INC-1", "acme/checkout", IncidentStatus.WORKFLOW_TRIGGERED);
        store(fixture, "INC-2", "acme/checkout", IncidentStatus.IN_PROGRESS);
        store(fixture, "INC-3", "acme/payments", IncidentStatus.IN_PROGRESS);
        store(fixture, "INC-4", "acme/payments", IncidentStatus.PENDING);
        store(fixture, "INC-5", "acme/search", IncidentStatus.PR_CREATED);

        DispatchStateReconciler reconciler =
                new DispatchStateReconciler(fixture.incidentRepository, fixture.queueManager, fixture.properties);
        reconciler.reconcile();

        assertThat(fixture.queueManager.activeCount("acme/checkout")).isEqualTo(2);
        assertThat(fixture.queueManager.activeCount("acme/payments")).isEqualTo(1);
        assertThat(fixture.queueManager.activeCount("acme/search")).isZero();
        assertThat(fixture.queueManager.queuedCount("acme/payments")).isZero();
    }

    @Test
    void disabledReconciliationLeavesStateAlone() {
        MenderTestFixture fixture = new MenderTestFixture(new ScriptedTransport(),
                properties -> properties.getDispatch().setReconcileOnStartup(false));
        store(fixture, "INC-1", "acme/checkout", IncidentStatus.IN_PROGRESS);

        new DispatchStateReconciler(fixture.incidentRepository, fixture.queueManager, fixture.properties)
                .onApplicationReady();

        assertThat(fixture.queueManager.activeCount("acme/checkout")).isZero();
    }

    private static void store(MenderTestFixture fixture, String id, String repository, IncidentStatus status) {
        fixture.incidentRepository.create(Incident.builder()
                .id(id)
                .serviceName("svc")
                .repository(repository)
                .errorMessage("boom")
                .status(status)
                .createdAt(fixture.clock.instant())
                .build());
    }
}
