package com.z254.mender.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class IncidentEventDto {
    private long id;
    private String incidentId;
    private String eventType;
    private Map<String, Object> details;
    private Instant createdAt;
}
