package com.z254.mender.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of the hot-reloadable routing file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingConfigDocument {

    @JsonProperty("service_mappings")
    private List<Mapping> serviceMappings = new ArrayList<>();

    @JsonProperty("custom_rules")
    private List<RoutingRule> customRules = new ArrayList<>();

    private Concurrency concurrency;

    private Deduplication deduplication;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Mapping {
        @JsonProperty("service_name")
        private String serviceName;
        private String repository;
        private String branch;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Concurrency {
        @JsonProperty("max_workflows_per_repo")
        private Integer maxWorkflowsPerRepo;

        @JsonProperty("repository_limits")
        private Map<String, Integer> repositoryLimits = new HashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Deduplication {
        /** Duration such as {@code 5m} or {@code PT5M} */
        @JsonProperty("time_window")
        private String timeWindow;
    }
}
