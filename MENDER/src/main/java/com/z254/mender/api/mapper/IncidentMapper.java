package com.z254.mender.api.mapper;

import com.z254.mender.api.dto.ConfigResponse;
import com.z254.mender.api.dto.DispatchStatusDto;
import com.z254.mender.api.dto.IncidentDto;
import com.z254.mender.api.dto.IncidentEventDto;
import com.z254.mender.dispatch.RepositoryDispatchState;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentEvent;
import com.z254.mender.domain.model.ServiceMapping;

/**
 * Mapper for domain to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(Incident incident) {
        return IncidentDto.builder()
                .id(incident.getId())
                .serviceName(incident.getServiceName())
                .repository(incident.getRepository())
                .errorMessage(incident.getErrorMessage())
                .stackTrace(incident.getStackTrace())
                .severity(incident.getSeverity())
                .status(incident.getStatus().getValue())
                .provider(incident.getProvider())
                .providerData(incident.getProviderData())
                .workflowRunId(incident.getWorkflowRunId())
                .pullRequestUrl(incident.getPullRequestUrl())
                .diagnosis(incident.getDiagnosis())
                .createdAt(incident.getCreatedAt())
                .updatedAt(incident.getUpdatedAt())
                .triggeredAt(incident.getTriggeredAt())
                .completedAt(incident.getCompletedAt())
                .build();
    }

    public static IncidentEventDto toDto(IncidentEvent event) {
        return IncidentEventDto.builder()
                .id(event.getId())
                .incidentId(event.getIncidentId())
                .eventType(event.getEventType().getValue())
                .details(event.getDetails())
                .createdAt(event.getCreatedAt())
                .build();
    }

    public static DispatchStatusDto toDto(RepositoryDispatchState state, int maxConcurrency) {
        return DispatchStatusDto.builder()
                .repository(state.repository())
                .active(state.active())
                .queued(state.queued())
                .maxConcurrency(maxConcurrency)
                .queuedIncidentIds(state.queuedIncidentIds())
                .build();
    }

    public static ConfigResponse.ServiceMappingDto toDto(ServiceMapping mapping) {
        return ConfigResponse.ServiceMappingDto.builder()
                .serviceName(mapping.serviceName())
                .repository(mapping.repository())
                .branch(mapping.branch())
                .build();
    }
}
