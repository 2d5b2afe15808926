package com.z254.mender.routing;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.z254.mender.config.MenderProperties;
import com.z254.mender.config.OrchestrationSettings;
import com.z254.mender.config.OrchestrationSettingsHolder;
import com.z254.mender.domain.model.ServiceMapping;
import com.z254.mender.observability.MenderMetrics;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.observability.MenderStructuredLogger.RoutingEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Watches the routing file and swaps routing table, rules and limits when it changes.
 * <p>
 * A file that fails to parse or validate is rejected as a whole; the previous configuration
 * stays in effect.
 */
@Slf4j
@Component
public class RoutingConfigReloader {

    private final MenderProperties properties;
    private final RoutingTable routingTable;
    private final RoutingRuleEngine ruleEngine;
    private final OrchestrationSettingsHolder settingsHolder;
    private final MenderStructuredLogger structuredLogger;
    private final MenderMetrics metrics;
    private final YAMLMapper yamlMapper = new YAMLMapper();

    private volatile FileTime lastModified;

    public RoutingConfigReloader(MenderProperties properties,
                                 RoutingTable routingTable,
                                 RoutingRuleEngine ruleEngine,
                                 OrchestrationSettingsHolder settingsHolder,
                                 MenderStructuredLogger structuredLogger,
                                 MenderMetrics metrics) {
        this.properties = properties;
        this.routingTable = routingTable;
        this.ruleEngine = ruleEngine;
        this.settingsHolder = settingsHolder;
        this.structuredLogger = structuredLogger;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "#{@menderProperties.routing.reloadInterval.toMillis()}")
    public void reloadIfChanged() {
        String file = properties.getRouting().getMappingsFile();
        if (file == null || file.isBlank()) {
            return;
        }
        Path path = Path.of(file);
        if (!Files.exists(path)) {
            log.debug("Routing file {} does not exist", path);
            return;
        }
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            if (modified.equals(lastModified)) {
                return;
            }
            if (reload(path)) {
                lastModified = modified;
            }
        } catch (IOException e) {
            log.warn("Failed to stat routing file {}: {}", path, e.getMessage());
        }
    }

    /**
     * Parse and apply {@code path}.
     *
     * @return whether the new configuration was applied
     */
    public boolean reload(Path path) {
        try {
            RoutingConfigDocument document = yamlMapper.readValue(path.toFile(), RoutingConfigDocument.class);
            apply(document);
            metrics.recordRoutingReload();
            structuredLogger.logRoutingEvent(RoutingEventType.RELOADED, "Routing configuration reloaded",
                    Map.of("file", path.toString(),
                            "mappings", routingTable.size(),
                            "rules", ruleEngine.rules().size()));
            return true;
        } catch (IOException | RuntimeException e) {
            metrics.recordRoutingReloadFailure();
            structuredLogger.logRoutingEvent(RoutingEventType.RELOAD_FAILED,
                    "Routing configuration rejected, keeping previous snapshot",
                    Map.of("file", path.toString(), "error", String.valueOf(e.getMessage())));
            return false;
        }
    }

    /**
     * Validates every section before publishing any of them, so a rejected file leaves routing,
     * rules and limits untouched.
     */
    void apply(RoutingConfigDocument document) {
        String defaultBranch = routingTable.getDefaultBranch();
        List<ServiceMapping> mappings = document.getServiceMappings().stream()
                .map(mapping -> new ServiceMapping(mapping.getServiceName(), mapping.getRepository(),
                        mapping.getBranch() != null ? mapping.getBranch() : defaultBranch))
                .toList();
        List<RoutingRule> rules = document.getCustomRules() != null ? document.getCustomRules() : List.of();
        rules.forEach(RoutingRule::validate);
        Duration window = parseWindow(document.getDeduplication());
        RoutingConfigDocument.Concurrency concurrency = document.getConcurrency();
        Integer defaultLimit = parseDefaultLimit(concurrency);
        Map<String, Integer> repositoryLimits = parseRepositoryLimits(concurrency);

        ruleEngine.replace(rules);
        routingTable.replace(mappings);
        settingsHolder.update(current -> withLimits(current, defaultLimit, repositoryLimits, window));
    }

    private static OrchestrationSettings withLimits(OrchestrationSettings current,
                                                    Integer defaultLimit,
                                                    Map<String, Integer> repositoryLimits,
                                                    Duration window) {
        OrchestrationSettings.OrchestrationSettingsBuilder builder = current.toBuilder();
        if (defaultLimit != null) {
            builder.defaultMaxConcurrency(defaultLimit);
        }
        if (repositoryLimits != null) {
            builder.repositoryLimits(repositoryLimits);
        }
        if (window != null) {
            builder.deduplicationWindow(window);
        }
        return builder.build();
    }

    private static Integer parseDefaultLimit(RoutingConfigDocument.Concurrency concurrency) {
        if (concurrency == null || concurrency.getMaxWorkflowsPerRepo() == null) {
            return null;
        }
        if (concurrency.getMaxWorkflowsPerRepo() < 1) {
            throw new IllegalArgumentException(
                    "max_workflows_per_repo must be positive: " + concurrency.getMaxWorkflowsPerRepo());
        }
        return concurrency.getMaxWorkflowsPerRepo();
    }

    private static Map<String, Integer> parseRepositoryLimits(RoutingConfigDocument.Concurrency concurrency) {
        if (concurrency == null || concurrency.getRepositoryLimits() == null) {
            return null;
        }
        Map<String, Integer> limits = new HashMap<>();
        concurrency.getRepositoryLimits().forEach((repository, limit) -> {
            if (repository == null || repository.isBlank()) {
                throw new IllegalArgumentException("repository_limits entry without repository");
            }
            if (limit == null || limit < 1) {
                throw new IllegalArgumentException(
                        "repository_limits." + repository + " must be positive: " + limit);
            }
            limits.put(repository, limit);
        });
        return Map.copyOf(limits);
    }

    private static Duration parseWindow(RoutingConfigDocument.Deduplication deduplication) {
        if (deduplication == null || deduplication.getTimeWindow() == null
                || deduplication.getTimeWindow().isBlank()) {
            return null;
        }
        Duration window = DurationStyle.detectAndParse(deduplication.getTimeWindow());
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Deduplication window must be positive: " + window);
        }
        return window;
    }
}
