package com.z254.mender.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Completion signal sent back by the remediation workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowCompletion {

    /** Incident id; may be omitted when the run id is known */
    @JsonAlias("incident_id")
    private String incidentId;

    @NotBlank
    private String repository;

    @JsonAlias({"run_id", "dispatch_id"})
    private String runId;

    @NotNull
    @JsonAlias("status")
    private WorkflowOutcome outcome;

    private String diagnosis;

    @JsonAlias({"pr_url", "pull_request_url"})
    private String pullRequestUrl;

    public boolean hasPullRequest() {
        return pullRequestUrl != null && !pullRequestUrl.isBlank();
    }
}
