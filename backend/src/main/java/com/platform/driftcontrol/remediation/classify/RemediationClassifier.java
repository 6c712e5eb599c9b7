package com.platform.driftcontrol.remediation.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftcontrol.drift.ChangeType;
import com.platform.driftcontrol.drift.DriftResult;
import com.platform.driftcontrol.drift.DriftedProperty;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationSeverity;
import com.platform.driftcontrol.remediation.RemediationStatus;
import com.platform.driftcontrol.remediation.RemediationStrategy;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps a drifted property to a remediation strategy and a risk severity.
 * 
 * Both decisions are ordered rule tables evaluated first-match-wins, so the precedence
 * between overlapping markers (e.g. "security_group_name") is fixed by list order.
 * The classifier holds no mutable state: the same (resource name, path, change type)
 * always classifies the same way.
 */
public class RemediationClassifier {
    
    private static final ObjectMapper VALUE_FORMAT = new ObjectMapper();
    
    private static final Pattern PATH_SEGMENTS = Pattern.compile("[.\\[\\]]+");
    
    private static final List<String> READ_ONLY_MARKERS = List.of(
        "arn", "id", "created_at", "updated_at", "last_modified", "creation_date", "state", "status"
    );
    
    private static final List<PathRule<RemediationSeverity>> SEVERITY_RULES = List.of(
        new PathRule<>("deletion",
            (path, change) -> change == ChangeType.REMOVED || path.contains("delete"),
            RemediationSeverity.CRITICAL),
        PathRule.containsAny(RemediationSeverity.HIGH_RISK,
            "security_group", "ingress", "egress", "instance_type", "subnet", "vpc"),
        PathRule.containsAny(RemediationSeverity.MEDIUM_RISK,
            "policy", "role", "permission", "encryption"),
        PathRule.containsAny(RemediationSeverity.LOW_RISK,
            "description", "name", "monitoring"),
        PathRule.containsAny(RemediationSeverity.SAFE,
            "tag", "label")
    );
    
    private static final RemediationSeverity DEFAULT_SEVERITY = RemediationSeverity.MEDIUM_RISK;
    
    private static final RemediationStrategy DEFAULT_STRATEGY = RemediationStrategy.TERRAFORM_APPLY;
    
    private final List<PathRule<RemediationStrategy>> strategyRules;
    private final Clock clock;
    
    /**
     * Classifier with the built-in rules only.
     */
    public RemediationClassifier() {
        this(List.of(), Clock.systemUTC());
    }
    
    /**
     * @param sourceRewritePatterns path substrings routed to {@link RemediationStrategy#TERRAFORM_UPDATE},
     *                              checked after the read-only and secret rules
     * @param clock                 stamps {@code createdAt} on generated actions
     */
    public RemediationClassifier(List<String> sourceRewritePatterns, Clock clock) {
        this.clock = clock;
        List<PathRule<RemediationStrategy>> rules = new ArrayList<>();
        rules.add(new PathRule<>("read-only attribute",
            (path, change) -> isReadOnly(path),
            RemediationStrategy.IGNORE));
        rules.add(PathRule.containsAny(RemediationStrategy.MANUAL,
            "password", "secret", "private_key", "certificate"));
        if (sourceRewritePatterns != null && !sourceRewritePatterns.isEmpty()) {
            rules.add(PathRule.containsAny(RemediationStrategy.TERRAFORM_UPDATE,
                sourceRewritePatterns.stream()
                    .map(p -> p.toLowerCase(Locale.ROOT))
                    .toArray(String[]::new)));
        }
        this.strategyRules = List.copyOf(rules);
    }
    
    public Classification classify(String resourceName, String propertyPath, ChangeType changeType) {
        String path = propertyPath == null ? "" : propertyPath.toLowerCase(Locale.ROOT);
        return new Classification(
            firstMatch(strategyRules, path, changeType, DEFAULT_STRATEGY),
            firstMatch(SEVERITY_RULES, path, changeType, DEFAULT_SEVERITY),
            inferResourceType(resourceName)
        );
    }
    
    /**
     * Build the action for one drifted property, or nothing when the drift is ignorable.
     */
    public Optional<RemediationAction> createAction(DriftResult drift, DriftedProperty property) {
        Classification classification = classify(
            drift.resourceName(), property.propertyPath(), property.changeType());
        
        if (classification.isIgnored()) {
            return Optional.empty();
        }
        
        return Optional.of(RemediationAction.builder()
            .driftId(drift.resourceId())
            .resourceName(drift.resourceName())
            .resourceType(classification.resourceType())
            .propertyPath(property.propertyPath())
            .strategy(classification.strategy())
            .severity(classification.severity())
            .currentValue(property.actualValue())
            .desiredValue(property.expectedValue())
            .description(describe(drift, property, classification.strategy()))
            .requiresApproval(classification.requiresApproval())
            .status(RemediationStatus.PENDING)
            .createdAt(clock.instant())
            .build());
    }
    
    /**
     * Resource family from substrings of the resource name; compute when nothing matches.
     */
    public static String inferResourceType(String resourceName) {
        String name = resourceName == null ? "" : resourceName.toLowerCase(Locale.ROOT);
        if (name.contains("ec2") || name.contains("instance")) return "compute";
        if (name.contains("s3") || name.contains("bucket")) return "storage";
        if (name.contains("vpc") || name.contains("subnet") || name.contains("sg")) return "network";
        if (name.contains("rds") || name.contains("db")) return "database";
        if (name.contains("iam") || name.contains("role")) return "security";
        return "compute";
    }
    
    /**
     * A path segment is read-only when it is a marker or ends in "_marker" (owner_id, instance_state).
     * Matching whole segments keeps "cidr_blocks" or "tags.Owner" from hitting "id"/"owner".
     */
    static boolean isReadOnly(String lowerPath) {
        for (String segment : PATH_SEGMENTS.split(lowerPath)) {
            if (segment.isEmpty()) {
                continue;
            }
            for (String marker : READ_ONLY_MARKERS) {
                if (segment.equals(marker) || segment.endsWith("_" + marker)) {
                    return true;
                }
            }
        }
        return false;
    }
    
    private static <T> T firstMatch(List<PathRule<T>> rules, String path, ChangeType changeType, T fallback) {
        for (PathRule<T> rule : rules) {
            if (rule.matches(path, changeType)) {
                return rule.outcome();
            }
        }
        return fallback;
    }
    
    private static String describe(DriftResult drift, DriftedProperty property, RemediationStrategy strategy) {
        String verb = switch (strategy) {
            case TERRAFORM_UPDATE -> "Update Terraform configuration";
            case TERRAFORM_APPLY -> "Apply infrastructure change";
            default -> "Manual intervention required";
        };
        return String.format("%s: %s.%s from %s to %s",
            verb,
            drift.resourceName(),
            property.propertyPath(),
            formatValue(property.actualValue()),
            formatValue(property.expectedValue()));
    }
    
    private static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        try {
            return VALUE_FORMAT.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
