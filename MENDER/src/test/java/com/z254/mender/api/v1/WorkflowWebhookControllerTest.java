package com.z254.mender.api.v1;

import com.z254.mender.api.GlobalExceptionHandler;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.model.IncidentStatus;
import com.z254.mender.domain.model.NormalizedIncident;
import com.z254.mender.support.MenderTestFixture;
import com.z254.mender.support.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static com.z254.mender.support.MenderTestFixture.mapping;
import static org.assertj.core.api.Assertions.assertThat;

class WorkflowWebhookControllerTest {

    private MenderTestFixture fixture;
    private WebTestClient client;
    private Incident incident;

    @BeforeEach
    void setUp() {
        fixture = new MenderTestFixture(new ScriptedTransport(), properties ->
                properties.getRouting().setServiceMappings(List.of(mapping("checkout", "acme/checkout"))));
        client = WebTestClient.bindToController(new WorkflowWebhookController(fixture.orchestrator))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
        incident = fixture.orchestrator.createIncident(NormalizedIncident.builder()
                .serviceName("checkout")
                .errorMessage("boom")
                .provider("sentry")
                .build()).block();
    }

    @Test
    void successWithPullRequestMovesToPrCreated() {
        client.post().uri("/api/v1/webhooks/workflow-status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "incident_id", incident.getId(),
                        "repository", "acme/checkout",
                        "status", "success",
                        "pr_url", "https://github.com/acme/checkout/pull/12",
                        "diagnosis", "Null cart on empty session"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("pr_created")
                .jsonPath("$.pullRequestUrl").isEqualTo("https://github.com/acme/checkout/pull/12")
                .jsonPath("$.diagnosis").isEqualTo("Null cart on empty session");
    }

    @Test
    void callbackByRunIdOnly() {
        client.post().uri("/api/v1/webhooks/workflow-status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "run_id", incident.getWorkflowRunId(),
                        "repository", "acme/checkout",
                        "status", "in_progress"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo(incident.getId())
                .jsonPath("$.status").isEqualTo("in_progress");
    }

    @Test
    void missingOutcomeIsRejected() {
        client.post().uri("/api/v1/webhooks/workflow-status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("incident_id", incident.getId(), "repository", "acme/checkout"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("INVALID_REQUEST");
        assertThat(fixture.incidentRepository.findById(incident.getId()).orElseThrow().getStatus())
                .isEqualTo(IncidentStatus.WORKFLOW_TRIGGERED);
    }

    @Test
    void unknownOutcomeIsMalformed() {
        client.post().uri("/api/v1/webhooks/workflow-status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("incident_id", incident.getId(), "repository", "acme/checkout", "status", "exploded"))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void callbackForUnknownIncidentIsNotFound() {
        client.post().uri("/api/v1/webhooks/workflow-status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("incident_id", "INC-404", "repository", "acme/checkout", "status", "failed"))
                .exchange()
                .expectStatus().isNotFound();
    }
}
