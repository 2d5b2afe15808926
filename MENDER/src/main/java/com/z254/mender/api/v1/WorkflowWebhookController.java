package com.z254.mender.api.v1;

import com.z254.mender.api.dto.IncidentDto;
import com.z254.mender.api.mapper.IncidentMapper;
import com.z254.mender.domain.model.WorkflowCompletion;
import com.z254.mender.orchestrator.IncidentOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Receives status callbacks from remediation workflows.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@Tag(name = "Workflows", description = "Remediation workflow completion callbacks")
public class WorkflowWebhookController {

    private final IncidentOrchestrator orchestrator;

    public WorkflowWebhookController(IncidentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/workflow-status")
    @Operation(summary = "Workflow status callback",
               description = "Report progress or completion of a remediation workflow run")
    public Mono<ResponseEntity<IncidentDto>> workflowStatus(@Valid @RequestBody WorkflowCompletion completion) {
        log.debug("Workflow callback: incident={}, run={}, outcome={}",
                completion.getIncidentId(), completion.getRunId(), completion.getOutcome());
        return orchestrator.onWorkflowCompletion(completion)
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok);
    }
}
