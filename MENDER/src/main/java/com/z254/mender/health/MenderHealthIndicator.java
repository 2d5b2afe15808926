package com.z254.mender.health;

import com.z254.mender.config.OrchestrationSettings;
import com.z254.mender.config.OrchestrationSettingsHolder;
import com.z254.mender.dispatch.DispatchQueueManager;
import com.z254.mender.dispatch.GitHubWorkflowDispatchClient;
import com.z254.mender.dispatch.RepositoryDispatchState;
import com.z254.mender.routing.RoutingTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for MENDER service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Routing table size</li>
 *     <li>Dispatch capacity per repository</li>
 *     <li>Whether the GitHub client has a token</li>
 * </ul>
 * An empty routing table reports DOWN: every incident would be unroutable.
 */
@Slf4j
@Component
public class MenderHealthIndicator implements ReactiveHealthIndicator {

    private final RoutingTable routingTable;
    private final DispatchQueueManager queueManager;
    private final OrchestrationSettingsHolder settingsHolder;
    private final GitHubWorkflowDispatchClient gitHubClient;

    public MenderHealthIndicator(RoutingTable routingTable,
                                 DispatchQueueManager queueManager,
                                 OrchestrationSettingsHolder settingsHolder,
                                 GitHubWorkflowDispatchClient gitHubClient) {
        this.routingTable = routingTable;
        this.queueManager = queueManager;
        this.settingsHolder = settingsHolder;
        this.gitHubClient = gitHubClient;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        OrchestrationSettings settings = settingsHolder.current();

        int mappings = routingTable.size();
        details.put("routing.mappings", mappings);
        details.put("github.configured", gitHubClient.isConfigured());
        details.put("deduplicationWindow", settings.getDeduplicationWindow().toString());

        Map<String, Object> capacity = new HashMap<>();
        for (RepositoryDispatchState state : queueManager.snapshot().values()) {
            int ceiling = settings.maxConcurrencyFor(state.repository());
            capacity.put(state.repository(), Map.of(
                    "active", state.active(),
                    "queued", state.queued(),
                    "maxConcurrency", ceiling,
                    "status", state.active() >= ceiling ? "AT_LIMIT" : "AVAILABLE"));
        }
        details.put("dispatch", capacity);

        if (mappings == 0) {
            details.put("routing.error", "No service mappings configured");
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
