package com.z254.mender.observability;

import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.domain.model.WorkflowOutcome;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MenderMetricsTest {

    private SimpleMeterRegistry registry;
    private MenderMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MenderMetrics(registry);
    }

    @Test
    void transitionsAreCountedPerStatus() {
        metrics.recordTransition(IncidentStatus.WORKFLOW_TRIGGERED);
        metrics.recordTransition(IncidentStatus.WORKFLOW_TRIGGERED);
        metrics.recordTransition(IncidentStatus.FAILED);

        assertThat(registry.get("mender.incidents.transitions").tag("status", "workflow_triggered")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("mender.incidents.transitions").tag("status", "failed")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void completionsAreCountedPerOutcome() {
        metrics.recordCompletion(WorkflowOutcome.SUCCESS);

        assertThat(registry.get("mender.workflows.completions").tag("outcome", "success")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void resolutionFeedsMttr() {
        metrics.recordIncidentResolved(Duration.ofMinutes(42));

        assertThat(metrics.getIncidentsResolved().count()).isEqualTo(1.0);
        Timer mttr = registry.get("mender.incidents.mttr").timer();
        assertThat(mttr.count()).isEqualTo(1);
        assertThat(mttr.totalTime(TimeUnit.MINUTES)).isEqualTo(42.0);
    }

    @Test
    void dispatchOutcomesStopLatencyTimer() {
        metrics.recordDispatchSucceeded(metrics.startDispatchTimer());
        metrics.recordDispatchFailed(metrics.startDispatchTimer());

        assertThat(metrics.getDispatchSucceeded().count()).isEqualTo(1.0);
        assertThat(metrics.getDispatchFailed().count()).isEqualTo(1.0);
        assertThat(registry.get("mender.dispatch.latency").timer().count()).isEqualTo(2);
    }

    @Test
    void repositoryGaugesAreRegisteredOnce() {
        AtomicInteger active = new AtomicInteger(2);
        metrics.registerRepositoryGauges("acme/checkout", active::get, () -> 5);
        metrics.registerRepositoryGauges("acme/checkout", () -> 99, () -> 99);

        assertThat(registry.get("mender.dispatch.active").tag("repository", "acme/checkout").gauge().value())
                .isEqualTo(2.0);
        active.set(1);
        assertThat(registry.get("mender.dispatch.active").tag("repository", "acme/checkout").gauge().value())
                .isEqualTo(1.0);
        assertThat(registry.get("mender.dispatch.backlog").tag("repository", "acme/checkout").gauge().value())
                .isEqualTo(5.0);
    }
}
