package com.z254.mender.api.v1;

import com.z254.mender.api.dto.ConfigResponse;
import com.z254.mender.api.dto.DispatchStatusDto;
import com.z254.mender.api.mapper.IncidentMapper;
import com.z254.mender.config.OrchestrationSettings;
import com.z254.mender.config.OrchestrationSettingsHolder;
import com.z254.mender.dispatch.DispatchQueueManager;
import com.z254.mender.dispatch.RepositoryDispatchState;
import com.z254.mender.routing.RoutingRule;
import com.z254.mender.routing.RoutingRuleEngine;
import com.z254.mender.routing.RoutingTable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only operator views of routing configuration and dispatch capacity.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Operations", description = "Routing configuration and dispatch capacity")
public class OperationsController {

    private final RoutingTable routingTable;
    private final RoutingRuleEngine ruleEngine;
    private final DispatchQueueManager queueManager;
    private final OrchestrationSettingsHolder settingsHolder;

    public OperationsController(RoutingTable routingTable,
                                RoutingRuleEngine ruleEngine,
                                DispatchQueueManager queueManager,
                                OrchestrationSettingsHolder settingsHolder) {
        this.routingTable = routingTable;
        this.ruleEngine = ruleEngine;
        this.queueManager = queueManager;
        this.settingsHolder = settingsHolder;
    }

    @GetMapping("/config")
    @Operation(summary = "Current configuration", description = "Service mappings, rules and limits in effect")
    public Mono<ResponseEntity<ConfigResponse>> getConfig() {
        return Mono.fromCallable(() -> {
            OrchestrationSettings settings = settingsHolder.current();
            return ResponseEntity.ok(ConfigResponse.builder()
                    .serviceMappings(routingTable.mappings().stream().map(IncidentMapper::toDto).toList())
                    .rules(ruleEngine.rules().stream().map(RoutingRule::getName).toList())
                    .defaultBranch(routingTable.getDefaultBranch())
                    .maxConcurrencyPerRepository(settings.getDefaultMaxConcurrency())
                    .repositoryLimits(settings.getRepositoryLimits())
                    .deduplicationWindow(settings.getDeduplicationWindow().toString())
                    .maxAttempts(settings.getMaxAttempts())
                    .build());
        });
    }

    @GetMapping("/dispatch")
    @Operation(summary = "Dispatch capacity", description = "Running and queued jobs for every known repository")
    public Mono<ResponseEntity<List<DispatchStatusDto>>> getDispatchStatus() {
        return Mono.fromCallable(() -> {
            OrchestrationSettings settings = settingsHolder.current();
            return ResponseEntity.ok(queueManager.snapshot().values().stream()
                    .map(state -> IncidentMapper.toDto(state, settings.maxConcurrencyFor(state.repository())))
                    .toList());
        });
    }

    @GetMapping("/dispatch/{owner}/{repo}")
    @Operation(summary = "Repository dispatch capacity", description = "Running and queued jobs for one repository")
    public Mono<ResponseEntity<DispatchStatusDto>> getRepositoryDispatchStatus(@PathVariable String owner,
                                                                              @PathVariable String repo) {
        return Mono.fromCallable(() -> {
            String repository = owner + "/" + repo;
            RepositoryDispatchState state = queueManager.snapshot().getOrDefault(repository,
                    new RepositoryDispatchState(repository, 0, List.of()));
            return ResponseEntity.ok(IncidentMapper.toDto(state,
                    settingsHolder.current().maxConcurrencyFor(repository)));
        });
    }
}
