package com.z254.mender.routing;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.z254.mender.domain.exception.RoutingRuleValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Operator-defined rule that adjusts an incident before routing.
 * <p>
 * Bound from {@code mender.routing.rules} and from the {@code custom_rules} section of the
 * routing file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingRule {

    public static final Set<String> SEVERITIES = Set.of("critical", "high", "medium", "low");

    private String name;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private Conditions conditions = new Conditions();

    @Builder.Default
    private Actions actions = new Actions();

    /**
     * All specified conditions must match.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Conditions {
        @JsonAlias("service_name")
        private String serviceName;

        /** Regular expression searched for anywhere in the error message */
        @JsonAlias("error_pattern")
        private String errorPattern;

        private String severity;

        private String provider;

        @Builder.Default
        private Map<String, String> metadata = new HashMap<>();

        boolean isEmpty() {
            return serviceName == null && isBlank(errorPattern) && severity == null && provider == null
                    && (metadata == null || metadata.isEmpty());
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Actions {
        @JsonAlias("set_severity")
        private String setSeverity;

        @JsonAlias("add_metadata")
        @Builder.Default
        private Map<String, String> addMetadata = new HashMap<>();

        @JsonAlias("set_repository")
        private String setRepository;

        @JsonAlias("skip_remediation")
        private boolean skipRemediation;

        boolean isEmpty() {
            return setSeverity == null && (addMetadata == null || addMetadata.isEmpty())
                    && setRepository == null && !skipRemediation;
        }
    }

    /**
     * @throws RoutingRuleValidationException when the rule cannot be evaluated
     */
    public void validate() {
        if (isBlank(name)) {
            throw new RoutingRuleValidationException("Routing rule name is required");
        }
        if (conditions == null || conditions.isEmpty()) {
            throw new RoutingRuleValidationException("Routing rule '" + name + "' must have at least one condition");
        }
        if (actions == null || actions.isEmpty()) {
            throw new RoutingRuleValidationException("Routing rule '" + name + "' must have at least one action");
        }
        if (!isBlank(conditions.getErrorPattern())) {
            try {
                Pattern.compile(conditions.getErrorPattern());
            } catch (PatternSyntaxException e) {
                throw new RoutingRuleValidationException(
                        "Routing rule '" + name + "' has an invalid error pattern: " + e.getDescription(), e);
            }
        }
        if (conditions.getSeverity() != null && !SEVERITIES.contains(conditions.getSeverity())) {
            throw new RoutingRuleValidationException(
                    "Routing rule '" + name + "' has an invalid severity condition: " + conditions.getSeverity());
        }
        if (actions.getSetSeverity() != null && !SEVERITIES.contains(actions.getSetSeverity())) {
            throw new RoutingRuleValidationException(
                    "Routing rule '" + name + "' has an invalid severity action: " + actions.getSetSeverity());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
