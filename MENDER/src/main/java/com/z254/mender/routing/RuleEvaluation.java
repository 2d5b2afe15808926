package com.z254.mender.routing;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combined effect of all rules that matched one incident.
 *
 * @param severity           severity after {@code setSeverity} actions
 * @param metadata           metadata added by {@code addMetadata} actions
 * @param repositoryOverride repository named by the first matching rule that sets one
 * @param skipRemediation    whether any matching rule asked to skip dispatch
 * @param matchedRules       names of matching rules, in evaluation order
 */
public record RuleEvaluation(String severity,
                             Map<String, String> metadata,
                             Optional<String> repositoryOverride,
                             boolean skipRemediation,
                             List<String> matchedRules) {

    public static RuleEvaluation none(String severity) {
        return new RuleEvaluation(severity, Map.of(), Optional.empty(), false, List.of());
    }

    public boolean hasMatches() {
        return !matchedRules.isEmpty();
    }
}
