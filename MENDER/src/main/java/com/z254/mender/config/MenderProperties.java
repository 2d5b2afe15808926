package com.z254.mender.config;

import com.z254.mender.routing.RoutingRule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the MENDER service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Service to repository routing and custom routing rules</li>
 *     <li>Deduplication window</li>
 *     <li>Per-repository dispatch concurrency and retry policy</li>
 *     <li>GitHub workflow dispatch client settings</li>
 * </ul>
 * Values here seed {@link OrchestrationSettings}; the routing file watcher may replace them at runtime.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "mender")
public class MenderProperties {

    private final Routing routing = new Routing();
    private final Deduplication deduplication = new Deduplication();
    private final Dispatch dispatch = new Dispatch();
    private final GitHub github = new GitHub();

    /**
     * Service routing configuration.
     */
    @Data
    public static class Routing {
        private List<Mapping> serviceMappings = new ArrayList<>();

        /** Branch used when a mapping does not name one */
        @NotBlank
        private String defaultBranch = "main";

        /** Optional YAML file watched for routing and limit changes */
        private String mappingsFile;

        /** Poll interval for the mappings file */
        @NotNull
        private Duration reloadInterval = Duration.ofSeconds(30);

        private List<RoutingRule> rules = new ArrayList<>();

        @Data
        public static class Mapping {
            private String serviceName;
            private String repository;
            private String branch;
        }
    }

    /**
     * Incident deduplication configuration.
     */
    @Data
    public static class Deduplication {
        /** Sliding window within which identical errors collapse into one incident */
        @NotNull
        private Duration window = Duration.ofMinutes(5);
    }

    /**
     * Remediation dispatch configuration.
     */
    @Data
    public static class Dispatch {
        /** Default ceiling of concurrently running jobs per repository */
        @Positive
        private int maxConcurrencyPerRepository = 2;

        /** Per-repository overrides of the ceiling */
        private Map<String, Integer> repositoryLimits = new HashMap<>();

        /** Total transport attempts, including the first one */
        @Positive
        private int maxAttempts = 3;

        /** Delay before the second attempt; doubles on each further attempt */
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);

        /** Upper bound for a single transport call */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** Rebuild active counts from persisted incidents at startup */
        private boolean reconcileOnStartup = true;
    }

    /**
     * GitHub Actions workflow dispatch client configuration.
     */
    @Data
    public static class GitHub {
        @NotBlank
        private String apiUrl = "https://api.github.com";

        /** Token with actions:write; blank switches the client to stub mode */
        private String token;

        @NotBlank
        private String workflow = "remediation.yml";

        @NotBlank
        private String apiVersion = "2022-11-28";
    }
}
