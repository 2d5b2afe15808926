package com.z254.mender.health;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.dispatch.GitHubWorkflowDispatchClient;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.support.MenderTestFixture;
import com.z254.mender.support.ScriptedTransport;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

import static com.z254.mender.support.MenderTestFixture.mapping;
import static org.assertj.core.api.Assertions.assertThat;

class MenderHealthIndicatorTest {

    @Test
    void downWithoutMappings() {
        MenderTestFixture fixture = new MenderTestFixture(new ScriptedTransport());

        Health health = indicator(fixture).checkHealth();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("routing.mappings", 0)
                .containsEntry("github.configured", false);
    }

    @Test
    @SuppressWarnings("unchecked")
    void upReportsCapacityPerRepository() {
        MenderTestFixture fixture = new MenderTestFixture(new ScriptedTransport(), properties -> {
            properties.getRouting().setServiceMappings(List.of(mapping("checkout", "acme/checkout")));
            properties.getDispatch().setMaxConcurrencyPerRepository(1);
        });
        fixture.queueManager.admit("acme/checkout", Incident.builder().id("INC-1").build(), 1);

        Health health = indicator(fixture).checkHealth();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        Map<String, Object> dispatch = (Map<String, Object>) health.getDetails().get("dispatch");
        assertThat((Map<String, Object>) dispatch.get("acme/checkout"))
                .containsEntry("active", 1)
                .containsEntry("status", "AT_LIMIT");
    }

    private static MenderHealthIndicator indicator(MenderTestFixture fixture) {
        MenderProperties properties = fixture.properties;
        return new MenderHealthIndicator(fixture.routingTable, fixture.queueManager, fixture.settingsHolder,
                new GitHubWorkflowDispatchClient(WebClient.builder(), properties));
    }
}
