package com.z254.mender.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable snapshot of the tunables read on every orchestration call.
 */
@Value
@Builder(toBuilder = true)
public class OrchestrationSettings {

    Duration deduplicationWindow;
    int defaultMaxConcurrency;
    @Builder.Default
    Map<String, Integer> repositoryLimits = Map.of();
    int maxAttempts;
    Duration initialBackoff;
    Duration dispatchTimeout;

    public static OrchestrationSettings from(MenderProperties properties) {
        MenderProperties.Dispatch dispatch = properties.getDispatch();
        return OrchestrationSettings.builder()
                .deduplicationWindow(properties.getDeduplication().getWindow())
                .defaultMaxConcurrency(dispatch.getMaxConcurrencyPerRepository())
                .repositoryLimits(Map.copyOf(dispatch.getRepositoryLimits()))
                .maxAttempts(dispatch.getMaxAttempts())
                .initialBackoff(dispatch.getInitialBackoff())
                .dispatchTimeout(dispatch.getTimeout())
                .build();
    }

    /**
     * Ceiling for one repository; never below 1.
     */
    public int maxConcurrencyFor(String repository) {
        Integer limit = repositoryLimits.get(repository);
        int resolved = limit != null ? limit : defaultMaxConcurrency;
        return Math.max(1, resolved);
    }
}
