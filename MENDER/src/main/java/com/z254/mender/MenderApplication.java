package com.z254.mender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * MENDER - Autonomous Remediation Orchestrator.
 *
 * <p>MENDER provides:
 * <ul>
 *   <li>Incident intake - Normalized incidents from observability providers</li>
 *   <li>Deduplication - Repeated errors collapse into one incident</li>
 *   <li>Routing - Services map to the repository their fix belongs in</li>
 *   <li>Dispatch control - Per-repository concurrency ceilings with a FIFO backlog</li>
 * </ul>
 *
 * <p>MENDER integrates with:
 * <ul>
 *   <li>Provider adapters - Datadog, PagerDuty, Sentry and Grafana webhooks</li>
 *   <li>GitHub Actions - Remediation workflow dispatch and status callbacks</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class MenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(MenderApplication.class, args);
    }
}
