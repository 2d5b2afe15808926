package com.z254.mender.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for MENDER service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI menderOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MENDER Remediation Orchestrator API")
                        .description("""
                                MENDER turns observability incidents into remediation workflow runs.
                                
                                ## Features
                                
                                - **Deduplication**: Identical errors within a sliding window collapse into one incident
                                - **Routing**: Services map to the repository their fix is made in
                                - **Lifecycle**: Validated status transitions with a full audit trail
                                - **Dispatch control**: Per-repository concurrency ceilings with a FIFO backlog
                                
                                ## Integration
                                
                                MENDER integrates with:
                                - Provider webhook adapters: normalized incidents
                                - GitHub Actions: remediation workflow dispatch and completion callbacks
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("MENDER Team")
                                .email("mender@254studioz.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://mender-service:8090")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Incidents")
                                .description("Incident intake, querying and manual triggers"),
                        new Tag()
                                .name("Workflows")
                                .description("Remediation workflow completion callbacks"),
                        new Tag()
                                .name("Operations")
                                .description("Routing configuration and dispatch capacity")
                ));
    }
}
