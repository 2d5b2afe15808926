package com.z254.mender.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Dispatch capacity of one repository.
 */
@Data
@Builder
public class DispatchStatusDto {
    private String repository;
    private int active;
    private int queued;
    private int maxConcurrency;
    private List<String> queuedIncidentIds;
}
