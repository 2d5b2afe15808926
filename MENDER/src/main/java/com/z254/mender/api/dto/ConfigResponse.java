package com.z254.mender.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Routing and limit configuration currently in effect.
 */
@Data
@Builder
public class ConfigResponse {
    private List<ServiceMappingDto> serviceMappings;
    private List<String> rules;
    private String defaultBranch;
    private int maxConcurrencyPerRepository;
    private Map<String, Integer> repositoryLimits;
    private String deduplicationWindow;
    private int maxAttempts;

    @Data
    @Builder
    public static class ServiceMappingDto {
        private String serviceName;
        private String repository;
        private String branch;
    }
}
