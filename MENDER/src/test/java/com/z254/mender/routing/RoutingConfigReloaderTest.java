package com.z254.mender.routing;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.config.OrchestrationSettingsHolder;
import com.z254.mender.domain.model.ServiceMapping;
import com.z254.mender.observability.MenderMetrics;
import com.z254.mender.observability.MenderStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.z254.mender.support.MenderTestFixture.mapping;
import static org.assertj.core.api.Assertions.assertThat;

class RoutingConfigReloaderTest {

    @TempDir
    Path tempDir;

    private MenderProperties properties;
    private RoutingTable routingTable;
    private RoutingRuleEngine ruleEngine;
    private OrchestrationSettingsHolder settingsHolder;
    private MenderMetrics metrics;
    private RoutingConfigReloader reloader;

    @BeforeEach
    void setUp() {
        properties = new MenderProperties();
        properties.getRouting().setServiceMappings(List.of(mapping("legacy", "acme/legacy")));
        MenderStructuredLogger logger = new MenderStructuredLogger();
        metrics = new MenderMetrics(new SimpleMeterRegistry());
        routingTable = new RoutingTable(properties, logger);
        ruleEngine = new RoutingRuleEngine(properties, logger);
        settingsHolder = new OrchestrationSettingsHolder(properties);
        reloader = new RoutingConfigReloader(properties, routingTable, ruleEngine, settingsHolder, logger, metrics);
    }

    @Test
    void reloadAppliesMappingsRulesAndLimits() throws IOException {
        Path file = copySample();

        assertThat(reloader.reload(file)).isTrue();

        assertThat(routingTable.lookup("legacy")).isEmpty();
        assertThat(routingTable.lookup("checkout"))
                .contains(new ServiceMapping("checkout", "acme/checkout", "develop"));
        assertThat(routingTable.lookup("payments").map(ServiceMapping::branch)).contains("main");
        assertThat(ruleEngine.rules()).extracting(RoutingRule::getName).containsExactly("escalate-timeouts");
        assertThat(settingsHolder.current().maxConcurrencyFor("acme/checkout")).isEqualTo(1);
        assertThat(settingsHolder.current().maxConcurrencyFor("acme/payments")).isEqualTo(3);
        assertThat(settingsHolder.current().getDeduplicationWindow()).isEqualTo(Duration.ofMinutes(10));
        assertThat(metrics.getRoutingReloads().count()).isEqualTo(1.0);
    }

    @Test
    void invalidFileKeepsPreviousSnapshot() throws IOException {
        Path file = tempDir.resolve("routing.yml");
        Files.writeString(file, """
                service_mappings:
                  - service_name: checkout
                    repository: acme/checkout
                custom_rules:
                  - name: broken
                    enabled: true
                    conditions:
                      error_pattern: "([unclosed"
                    actions:
                      skip_remediation: true
                """);

        assertThat(reloader.reload(file)).isFalse();

        assertThat(routingTable.lookup("legacy")).isPresent();
        assertThat(routingTable.lookup("checkout")).isEmpty();
        assertThat(metrics.getRoutingReloadFailures().count()).isEqualTo(1.0);
    }

    @Test
    void mappingWithoutRepositoryIsRejected() throws IOException {
        Path file = tempDir.resolve("routing.yml");
        Files.writeString(file, """
                service_mappings:
                  - service_name: checkout
                """);

        assertThat(reloader.reload(file)).isFalse();
        assertThat(routingTable.lookup("legacy")).isPresent();
    }

    @Test
    void nullRepositoryLimitRejectsWholeFile() throws IOException {
        Path file = tempDir.resolve("routing.yml");
        Files.writeString(file, """
                service_mappings:
                  - service_name: checkout
                    repository: acme/checkout
                custom_rules:
                  - name: escalate
                    conditions:
                      error_pattern: timeout
                    actions:
                      set_severity: critical
                concurrency:
                  repository_limits:
                    acme/checkout: null
                """);

        assertThat(reloader.reload(file)).isFalse();

        assertThat(routingTable.lookup("legacy")).isPresent();
        assertThat(routingTable.lookup("checkout")).isEmpty();
        assertThat(ruleEngine.rules()).isEmpty();
        assertThat(settingsHolder.current().getRepositoryLimits()).isEmpty();
    }

    @Test
    void nonPositiveLimitsAreRejected() throws IOException {
        Path file = tempDir.resolve("routing.yml");
        Files.writeString(file, """
                service_mappings:
                  - service_name: checkout
                    repository: acme/checkout
                concurrency:
                  max_workflows_per_repo: 0
                """);

        assertThat(reloader.reload(file)).isFalse();
        assertThat(routingTable.lookup("checkout")).isEmpty();
        assertThat(settingsHolder.current().getDefaultMaxConcurrency()).isEqualTo(2);

        Files.writeString(file, """
                service_mappings:
                  - service_name: checkout
                    repository: acme/checkout
                concurrency:
                  repository_limits:
                    acme/checkout: -1
                """);

        assertThat(reloader.reload(file)).isFalse();
        assertThat(routingTable.lookup("checkout")).isEmpty();
    }

    @Test
    void rejectedFileIsRetriedOnNextPollAndAppliedOnceFixed() throws IOException {
        Path file = tempDir.resolve("routing.yml");
        Files.writeString(file, """
                service_mappings:
                  - service_name: checkout
                    repository: acme/checkout
                concurrency:
                  repository_limits:
                    acme/checkout: null
                """);
        properties.getRouting().setMappingsFile(file.toString());

        reloader.reloadIfChanged();
        reloader.reloadIfChanged();
        assertThat(routingTable.lookup("checkout")).isEmpty();
        assertThat(metrics.getRoutingReloadFailures().count()).isEqualTo(2.0);

        Files.writeString(file, """
                service_mappings:
                  - service_name: checkout
                    repository: acme/checkout
                concurrency:
                  repository_limits:
                    acme/checkout: 4
                """);
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60)));
        reloader.reloadIfChanged();

        assertThat(routingTable.lookup("checkout")).isPresent();
        assertThat(settingsHolder.current().maxConcurrencyFor("acme/checkout")).isEqualTo(4);
    }

    @Test
    void reloadIfChangedOnlyReadsModifiedFile() throws IOException {
        Path file = copySample();
        properties.getRouting().setMappingsFile(file.toString());

        reloader.reloadIfChanged();
        reloader.reloadIfChanged();
        assertThat(metrics.getRoutingReloads().count()).isEqualTo(1.0);

        Files.writeString(file, """
                service_mappings:
                  - service_name: search
                    repository: acme/search
                """);
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60)));
        reloader.reloadIfChanged();

        assertThat(metrics.getRoutingReloads().count()).isEqualTo(2.0);
        assertThat(routingTable.lookup("search")).isPresent();
        assertThat(routingTable.lookup("checkout")).isEmpty();
    }

    @Test
    void missingFileIsIgnored() {
        properties.getRouting().setMappingsFile(tempDir.resolve("absent.yml").toString());

        reloader.reloadIfChanged();

        assertThat(routingTable.lookup("legacy")).isPresent();
        assertThat(metrics.getRoutingReloadFailures().count()).isZero();
    }

    private Path copySample() throws IOException {
        Path file = tempDir.resolve("routing.yml");
        try (InputStream in = getClass().getResourceAsStream("/routing-sample.yml")) {
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
        }
        return file;
    }
}
