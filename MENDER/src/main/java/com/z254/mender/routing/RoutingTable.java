package com.z254.mender.routing;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.domain.model.ServiceMapping;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.observability.MenderStructuredLogger.RoutingEventType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service to repository lookup backed by an immutable snapshot that reloads swap atomically.
 */
@Component
public class RoutingTable {

    private final AtomicReference<Snapshot> snapshot;
    private final MenderStructuredLogger structuredLogger;
    private final String defaultBranch;

    public RoutingTable(MenderProperties properties, MenderStructuredLogger structuredLogger) {
        this.structuredLogger = structuredLogger;
        this.defaultBranch = properties.getRouting().getDefaultBranch();
        this.snapshot = new AtomicReference<>(Snapshot.EMPTY);
        replace(properties.getRouting().getServiceMappings().stream()
                .map(mapping -> new ServiceMapping(mapping.getServiceName(), mapping.getRepository(),
                        mapping.getBranch() != null ? mapping.getBranch() : defaultBranch))
                .toList());
    }

    public Optional<ServiceMapping> lookup(String serviceName) {
        if (serviceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get().byService().get(serviceName));
    }

    /**
     * Branch of the first mapping pointing at {@code repository}, else the default branch.
     */
    public String branchFor(String repository) {
        return snapshot.get().ordered().stream()
                .filter(mapping -> mapping.repository().equals(repository))
                .map(ServiceMapping::branch)
                .findFirst()
                .orElse(defaultBranch);
    }

    /**
     * Swap in a new set of mappings. A later mapping for the same service replaces an earlier one.
     */
    public void replace(Collection<ServiceMapping> mappings) {
        Map<String, ServiceMapping> byService = new LinkedHashMap<>();
        for (ServiceMapping mapping : mappings) {
            ServiceMapping previous = byService.put(mapping.serviceName(), mapping);
            if (previous != null) {
                structuredLogger.logRoutingEvent(RoutingEventType.DUPLICATE_MAPPING,
                        "Duplicate service mapping, keeping the later one",
                        Map.of("service", mapping.serviceName(),
                                "replaced", previous.repository(),
                                "repository", mapping.repository()));
            }
        }
        snapshot.set(new Snapshot(Map.copyOf(byService), List.copyOf(byService.values())));
    }

    public List<ServiceMapping> mappings() {
        return new ArrayList<>(snapshot.get().ordered());
    }

    public int size() {
        return snapshot.get().byService().size();
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    private record Snapshot(Map<String, ServiceMapping> byService, List<ServiceMapping> ordered) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), List.of());
    }
}
