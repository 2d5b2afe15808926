package com.z254.mender.api.v1;

import com.z254.mender.api.dto.IncidentDto;
import com.z254.mender.api.dto.IncidentEventDto;
import com.z254.mender.api.dto.IncidentListResponse;
import com.z254.mender.api.mapper.IncidentMapper;
import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.domain.model.NormalizedIncident;
import com.z254.mender.orchestrator.IncidentOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for incident intake and management.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident intake, querying and manual triggers")
public class IncidentController {

    private final IncidentOrchestrator orchestrator;

    public IncidentController(IncidentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @Operation(summary = "Report incident",
               description = "Accept a normalized incident; duplicates return the existing incident")
    public Mono<ResponseEntity<IncidentDto>> createIncident(@RequestBody NormalizedIncident request) {
        return orchestrator.createIncident(request)
                .map(IncidentMapper::toDto)
                .map(dto -> ResponseEntity.status(HttpStatus.ACCEPTED).body(dto));
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "List incidents newest first with optional filters")
    public Mono<ResponseEntity<IncidentListResponse>> listIncidents(
            @Parameter(description = "Filter by status, e.g. pending or pr_created")
            @RequestParam(required = false) String status,
            @Parameter(description = "Filter by service name")
            @RequestParam(required = false) String service,
            @Parameter(description = "Page number")
            @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "20") int size) {

        IncidentStatus statusFilter = IncidentStatus.fromValue(status);
        return orchestrator.listIncidents(statusFilter, service)
                .map(incidents -> ResponseEntity.ok(IncidentListResponse.builder()
                        .incidents(incidents.stream()
                                .skip((long) page * size)
                                .limit(size)
                                .map(IncidentMapper::toDto)
                                .toList())
                        .total(incidents.size())
                        .page(page)
                        .size(size)
                        .build()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Get incident details by ID")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {
        return orchestrator.getIncident(id)
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/events")
    @Operation(summary = "Get incident events", description = "Audit trail of an incident in order")
    public Mono<ResponseEntity<List<IncidentEventDto>>> getIncidentEvents(
            @Parameter(description = "Incident ID") @PathVariable String id) {
        return orchestrator.getEvents(id)
                .map(events -> ResponseEntity.ok(events.stream().map(IncidentMapper::toDto).toList()));
    }

    @PostMapping("/{id}/trigger")
    @Operation(summary = "Trigger remediation",
               description = "Re-enter a pending or failed incident into dispatch")
    public Mono<ResponseEntity<IncidentDto>> triggerRemediation(
            @Parameter(description = "Incident ID") @PathVariable String id) {
        log.info("Manual trigger requested for incident {}", id);
        return orchestrator.manualTrigger(id)
                .map(IncidentMapper::toDto)
                .map(dto -> ResponseEntity.status(HttpStatus.ACCEPTED).body(dto));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve incident", description = "Mark an incident whose pull request was merged as resolved")
    public Mono<ResponseEntity<IncidentDto>> resolveIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {
        return orchestrator.resolveIncident(id)
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok);
    }
}
