package com.phonepe.agentrecall.core.freshness;

import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.recall.MemoryResult;
import com.phonepe.agentrecall.core.recall.RecallFailure;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Checks batches of query results against the freshness, relevance, recall and cross-session objectives
 */
public class SLOComplianceEvaluator {
    public static final double CROSS_SESSION_TARGET_PERCENT = 90;
    public static final double CROSS_SESSION_CRITICAL_PERCENT = 70;
    private static final double CRITICAL_FRACTION_OF_TARGET = 0.8;

    private final SLOConfig config;
    private final Clock clock;

    public SLOComplianceEvaluator(SLOConfig config, Clock clock) {
        this.config = Objects.requireNonNullElse(config, SLOConfig.DEFAULT);
        this.clock = clock;
    }

    public ComplianceEvaluation evaluateFreshness(List<MemoryResult> results) {
        if (results.isEmpty()) {
            return new ComplianceEvaluation(0, 0, 0, List.of());
        }
        int compliant = 0;
        double totalStaleness = 0;
        for (final var result : results) {
            totalStaleness += Math.min(1.0, result.getStalenessScore());
            if (!result.isStale() && result.getStalenessScore() < 1.0) {
                compliant++;
            }
        }
        final var percent = (compliant * 100.0) / results.size();
        return new ComplianceEvaluation(compliant,
                                        results.size(),
                                        totalStaleness / results.size(),
                                        targetViolation(SLOType.FRESHNESS, "Freshness", percent));
    }

    public ComplianceEvaluation evaluateRelevance(List<MemoryResult> results) {
        if (results.isEmpty()) {
            return new ComplianceEvaluation(0, 0, 0, List.of());
        }
        final var threshold = config.getFreshness().getRelevanceThreshold();
        final var compliant = (int) results.stream()
                .filter(result -> result.getSemanticSimilarity() >= threshold)
                .count();
        final var percent = (compliant * 100.0) / results.size();
        return new ComplianceEvaluation(compliant,
                                        results.size(),
                                        0,
                                        targetViolation(SLOType.RELEVANCE, "Relevance", percent));
    }

    /**
     * Full compliance status for the namespace. Recall compliance is 100% when the batch returned anything, else 0%.
     * Cross-session success is 100% when nothing was attempted.
     */
    public SLOComplianceStatus evaluateNamespaceCompliance(Namespace namespace,
                                                           List<MemoryResult> results,
                                                           List<RecallFailure> failures,
                                                           int crossSessionAttempts,
                                                           int crossSessionSuccesses) {
        final var freshness = evaluateFreshness(results);
        final var relevance = evaluateRelevance(results);
        final var violations = new ArrayList<SLOViolation>();
        violations.addAll(freshness.getViolations());
        violations.addAll(relevance.getViolations());

        final var recallTarget = config.getFreshness().getRecallTargetPercent();
        final double recallRate = results.isEmpty() ? 0 : 100;
        if (recallRate < recallTarget) {
            violations.add(SLOViolation.builder()
                                   .sloType(SLOType.RECALL)
                                   .actualValue(recallRate)
                                   .requiredValue(recallTarget)
                                   .severity(ViolationSeverity.WARNING)
                                   .description(description("Recall rate", recallRate, recallTarget))
                                   .build());
        }

        final double crossSessionRate = crossSessionAttempts > 0
                                        ? (crossSessionSuccesses * 100.0) / crossSessionAttempts
                                        : 100;
        if (crossSessionRate < CROSS_SESSION_TARGET_PERCENT) {
            violations.add(SLOViolation.builder()
                                   .sloType(SLOType.CROSS_SESSION)
                                   .actualValue(crossSessionRate)
                                   .requiredValue(CROSS_SESSION_TARGET_PERCENT)
                                   .severity(crossSessionRate < CROSS_SESSION_CRITICAL_PERCENT
                                             ? ViolationSeverity.CRITICAL
                                             : ViolationSeverity.WARNING)
                                   .description(description("Cross-session recall",
                                                            crossSessionRate,
                                                            CROSS_SESSION_TARGET_PERCENT))
                                   .build());
        }

        return SLOComplianceStatus.builder()
                .namespaceKey(namespace.key())
                .compliant(violations.isEmpty())
                .freshnessCompliancePercent(freshness.compliancePercent())
                .relevanceCompliancePercent(relevance.compliancePercent())
                .recallCompliancePercent(recallRate)
                .crossSessionSuccessPercent(crossSessionRate)
                .failureCount(failures.size())
                .evaluatedAt(clock.instant())
                .sloConfig(config)
                .violations(violations)
                .build();
    }

    public SLOConfig config() {
        return config;
    }

    private List<SLOViolation> targetViolation(SLOType type, String label, double percent) {
        final var target = config.getFreshness().getRecallTargetPercent();
        if (percent >= target) {
            return List.of();
        }
        return List.of(SLOViolation.builder()
                               .sloType(type)
                               .actualValue(percent)
                               .requiredValue(target)
                               .severity(percent < target * CRITICAL_FRACTION_OF_TARGET
                                         ? ViolationSeverity.CRITICAL
                                         : ViolationSeverity.WARNING)
                               .description(description(label + " compliance", percent, target))
                               .build());
    }

    private static String description(String label, double actual, double target) {
        return String.format(Locale.ROOT, "%s at %.1f%%, target is %s%%", label, actual, formatTarget(target));
    }

    private static String formatTarget(double target) {
        return target == Math.rint(target)
               ? String.valueOf((long) target)
               : String.format(Locale.ROOT, "%.1f", target);
    }
}
