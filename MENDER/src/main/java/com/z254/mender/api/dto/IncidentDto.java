package com.z254.mender.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IncidentDto {
    private String id;
    private String serviceName;
    private String repository;
    private String errorMessage;
    private String stackTrace;
    private String severity;
    private String status;
    private String provider;
    private Map<String, Object> providerData;
    private String workflowRunId;
    private String pullRequestUrl;
    private String diagnosis;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant triggeredAt;
    private Instant completedAt;
}
