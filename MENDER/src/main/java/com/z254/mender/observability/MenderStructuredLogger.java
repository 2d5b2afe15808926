package com.z254.mender.observability;

import com.z254.mender.domain.model.IncidentEventType;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for MENDER service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for incident and repository ids</li>
 *     <li>Domain-specific logging methods for incidents, dispatch and routing</li>
 * </ul>
 */
@Slf4j
@Component
public class MenderStructuredLogger {

    // MDC keys
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_REPOSITORY = "repository";

    /**
     * Log an incident lifecycle event.
     */
    public void logIncidentEvent(String incidentId, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, incidentId))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.getValue());
            logData.put("incidentId", incidentId);

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case INCIDENT_FAILED, DISPATCH_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case DUPLICATE_DETECTED, STATUS_CHANGED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a dispatch queue or transport event.
     */
    public void logDispatchEvent(String repository, String incidentId, DispatchEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_REPOSITORY, repository,
                MDC_INCIDENT_ID, incidentId != null ? incidentId : ""))) {

            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("repository", repository);
            if (incidentId != null) {
                logData.put("incidentId", incidentId);
            }

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case ATTEMPT_FAILED, UNDERFLOW ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case EXHAUSTED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a routing configuration event.
     */
    public void logRoutingEvent(RoutingEventType eventType, String message, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", eventType.name());

        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case RELOAD_FAILED, DUPLICATE_MAPPING, UNROUTABLE ->
                    log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum DispatchEventType {
        ADMITTED, QUEUED, DEQUEUED, RELEASED, UNDERFLOW,
        IN_FLIGHT, ATTEMPT_FAILED, DISPATCHED, EXHAUSTED, RECONCILED
    }

    public enum RoutingEventType {
        RELOADED, RELOAD_FAILED, DUPLICATE_MAPPING, UNROUTABLE, RULE_MATCHED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
