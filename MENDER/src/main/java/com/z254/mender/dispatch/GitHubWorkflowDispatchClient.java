package com.z254.mender.dispatch;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.domain.exception.DispatchTransportException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link DispatchTransport} backed by the GitHub Actions {@code workflow_dispatch} API.
 * <p>
 * GitHub does not return a run id for a dispatch, so the generated dispatch id is passed to
 * the workflow as an input and used as the run identifier. Without a token the client runs
 * in stub mode and only logs the dispatch.
 */
@Slf4j
@Component
public class GitHubWorkflowDispatchClient implements DispatchTransport {

    static final String GITHUB_JSON = "application/vnd.github+json";
    static final String API_VERSION_HEADER = "X-GitHub-Api-Version";

    private final WebClient webClient;
    private final MenderProperties.GitHub github;

    public GitHubWorkflowDispatchClient(WebClient.Builder webClientBuilder, MenderProperties properties) {
        this.github = properties.getGithub();
        this.webClient = webClientBuilder
                .baseUrl(github.getApiUrl())
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON)
                .defaultHeader(API_VERSION_HEADER, github.getApiVersion())
                .build();
    }

    @Override
    @CircuitBreaker(name = "github-dispatch")
    public Mono<String> dispatch(DispatchRequest request) {
        if (!isConfigured()) {
            log.info("STUB: Would dispatch {} to {} for incident {}",
                    github.getWorkflow(), request.getRepository(), request.getIncidentId());
            return Mono.just(request.getDispatchId());
        }

        log.info("Dispatching workflow {} to {}@{} for incident {}",
                github.getWorkflow(), request.getRepository(), request.getBranch(), request.getIncidentId());

        return webClient.post()
                .uri("/repos/{owner}/{repo}/actions/workflows/{workflow}/dispatches",
                        owner(request.getRepository()), name(request.getRepository()), github.getWorkflow())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + github.getToken())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildBody(request))
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NO_CONTENT.value()) {
                        return response.releaseBody().thenReturn(request.getDispatchId());
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(new DispatchTransportException(
                                    "GitHub rejected dispatch to " + request.getRepository()
                                            + " with status " + response.statusCode().value() + ": " + body,
                                    response.statusCode().value())));
                })
                .onErrorMap(WebClientRequestException.class, error -> new DispatchTransportException(
                        "GitHub unreachable for " + request.getRepository() + ": " + error.getMessage(), error))
                .doOnSuccess(runId -> log.info("Workflow dispatched: incident={}, runId={}",
                        request.getIncidentId(), runId))
                .doOnError(error -> log.warn("Workflow dispatch failed: incident={}, error={}",
                        request.getIncidentId(), error.getMessage()));
    }

    public boolean isConfigured() {
        return github.getToken() != null && !github.getToken().isBlank();
    }

    Map<String, Object> buildBody(DispatchRequest request) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("incident_id", request.getIncidentId());
        inputs.put("dispatch_id", request.getDispatchId());
        inputs.put("error_message", request.getErrorMessage());
        inputs.put("stack_trace", request.getStackTrace() != null ? request.getStackTrace() : "");
        inputs.put("service_name", request.getServiceName());
        inputs.put("timestamp", request.getTimestamp().toString());

        Map<String, Object> body = new HashMap<>();
        body.put("ref", request.getBranch());
        body.put("inputs", inputs);
        return body;
    }

    private static String owner(String repository) {
        int slash = repository.indexOf('/');
        if (slash <= 0 || slash == repository.length() - 1) {
            throw new DispatchTransportException("Repository must be owner/name: " + repository, -1);
        }
        return repository.substring(0, slash);
    }

    private static String name(String repository) {
        return repository.substring(repository.indexOf('/') + 1);
    }
}
