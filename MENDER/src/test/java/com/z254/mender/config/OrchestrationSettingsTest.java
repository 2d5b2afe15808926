package com.z254.mender.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationSettingsTest {

    @Test
    void defaultsFromProperties() {
        OrchestrationSettings settings = OrchestrationSettings.from(new MenderProperties());

        assertThat(settings.getDeduplicationWindow()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.getDefaultMaxConcurrency()).isEqualTo(2);
        assertThat(settings.getMaxAttempts()).isEqualTo(3);
        assertThat(settings.getDispatchTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void repositoryLimitOverridesDefault() {
        MenderProperties properties = new MenderProperties();
        properties.getDispatch().setRepositoryLimits(Map.of("acme/checkout", 5));

        OrchestrationSettings settings = OrchestrationSettings.from(properties);

        assertThat(settings.maxConcurrencyFor("acme/checkout")).isEqualTo(5);
        assertThat(settings.maxConcurrencyFor("acme/payments")).isEqualTo(2);
    }

    @Test
    void ceilingIsNeverBelowOne() {
        OrchestrationSettings settings = OrchestrationSettings.builder()
                .defaultMaxConcurrency(0)
                .repositoryLimits(Map.of("acme/checkout", -3))
                .build();

        assertThat(settings.maxConcurrencyFor("acme/checkout")).isEqualTo(1);
        assertThat(settings.maxConcurrencyFor("acme/payments")).isEqualTo(1);
    }

    @Test
    void holderSwapsSnapshot() {
        OrchestrationSettingsHolder holder = new OrchestrationSettingsHolder(new MenderProperties());
        OrchestrationSettings before = holder.current();

        holder.update(settings -> settings.toBuilder().deduplicationWindow(Duration.ofMinutes(10)).build());

        assertThat(holder.current().getDeduplicationWindow()).isEqualTo(Duration.ofMinutes(10));
        assertThat(before.getDeduplicationWindow()).isEqualTo(Duration.ofMinutes(5));
    }
}
