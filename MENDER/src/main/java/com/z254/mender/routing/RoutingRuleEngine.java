package com.z254.mender.routing;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.domain.model.NormalizedIncident;
import com.z254.mender.observability.MenderStructuredLogger;
import com.z254.mender.observability.MenderStructuredLogger.RoutingEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Evaluates the enabled routing rules against incoming incidents.
 * <p>
 * Conditions are matched against the incident as received; actions of every matching
 * rule are then applied in rule order.
 */
@Slf4j
@Component
public class RoutingRuleEngine {

    private final AtomicReference<List<CompiledRule>> rules = new AtomicReference<>(List.of());
    private final MenderStructuredLogger structuredLogger;

    public RoutingRuleEngine(MenderProperties properties, MenderStructuredLogger structuredLogger) {
        this.structuredLogger = structuredLogger;
        replace(properties.getRouting().getRules());
    }

    /**
     * Validate and install a new rule set. Nothing changes if any rule is invalid.
     *
     * @throws com.z254.mender.domain.exception.RoutingRuleValidationException on the first invalid rule
     */
    public void replace(List<RoutingRule> newRules) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (RoutingRule rule : newRules != null ? newRules : List.<RoutingRule>of()) {
            rule.validate();
            if (rule.isEnabled()) {
                compiled.add(new CompiledRule(rule));
            }
        }
        rules.set(List.copyOf(compiled));
        log.info("Installed {} enabled routing rules", compiled.size());
    }

    public List<RoutingRule> rules() {
        return rules.get().stream().map(CompiledRule::rule).toList();
    }

    public RuleEvaluation evaluate(NormalizedIncident incident) {
        List<CompiledRule> snapshot = rules.get();
        if (snapshot.isEmpty()) {
            return RuleEvaluation.none(incident.getSeverity());
        }

        Map<String, String> incidentMetadata = stringify(incident.getProviderData());
        List<CompiledRule> matches = snapshot.stream()
                .filter(rule -> rule.matches(incident, incidentMetadata))
                .toList();
        if (matches.isEmpty()) {
            return RuleEvaluation.none(incident.getSeverity());
        }

        String severity = incident.getSeverity();
        Map<String, String> addedMetadata = new LinkedHashMap<>();
        String repositoryOverride = null;
        boolean skip = false;
        for (CompiledRule match : matches) {
            RoutingRule.Actions actions = match.rule().getActions();
            if (actions.getSetSeverity() != null) {
                severity = actions.getSetSeverity();
            }
            if (actions.getAddMetadata() != null) {
                addedMetadata.putAll(actions.getAddMetadata());
            }
            if (repositoryOverride == null && actions.getSetRepository() != null
                    && !actions.getSetRepository().isBlank()) {
                repositoryOverride = actions.getSetRepository();
            }
            skip |= actions.isSkipRemediation();
        }

        List<String> names = matches.stream().map(match -> match.rule().getName()).toList();
        structuredLogger.logRoutingEvent(RoutingEventType.RULE_MATCHED, "Routing rules matched",
                Map.of("service", incident.getServiceName(), "rules", String.join(",", names)));
        return new RuleEvaluation(severity, Map.copyOf(addedMetadata),
                Optional.ofNullable(repositoryOverride), skip, names);
    }

    private static Map<String, String> stringify(Map<String, Object> data) {
        Map<String, String> result = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((key, value) -> {
                if (value != null) {
                    result.put(key, value.toString());
                }
            });
        }
        return result;
    }

    private record CompiledRule(RoutingRule rule, Pattern errorPattern) {

        CompiledRule(RoutingRule rule) {
            this(rule, compile(rule.getConditions().getErrorPattern()));
        }

        private static Pattern compile(String pattern) {
            return pattern == null || pattern.isBlank() ? null : Pattern.compile(pattern);
        }

        boolean matches(NormalizedIncident incident, Map<String, String> metadata) {
            RoutingRule.Conditions conditions = rule.getConditions();
            if (conditions.getServiceName() != null
                    && !conditions.getServiceName().equals(incident.getServiceName())) {
                return false;
            }
            if (errorPattern != null
                    && (incident.getErrorMessage() == null || !errorPattern.matcher(incident.getErrorMessage()).find())) {
                return false;
            }
            if (conditions.getSeverity() != null && !conditions.getSeverity().equals(incident.getSeverity())) {
                return false;
            }
            if (conditions.getProvider() != null && !conditions.getProvider().equals(incident.getProvider())) {
                return false;
            }
            if (conditions.getMetadata() != null) {
                for (Map.Entry<String, String> expected : conditions.getMetadata().entrySet()) {
                    if (!Objects.equals(metadata.get(expected.getKey()), expected.getValue())) {
                        return false;
                    }
                }
            }
            return true;
        }
    }
}
