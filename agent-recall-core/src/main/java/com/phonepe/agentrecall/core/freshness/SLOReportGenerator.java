package com.phonepe.agentrecall.core.freshness;

import com.phonepe.agentrecall.core.recall.MemoryResult;
import com.phonepe.agentrecall.core.recall.RecallFailure;
import com.phonepe.agentrecall.core.recall.RecallFailureReason;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds periodic SLO reports and renders them as text
 */
public class SLOReportGenerator {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final String RULE = "=".repeat(64);

    private final FreshnessSLO slo;
    private final Clock clock;

    public SLOReportGenerator(FreshnessSLO slo, Clock clock) {
        this.slo = Objects.requireNonNullElse(slo, FreshnessSLO.DEFAULT);
        this.clock = clock;
    }

    public static Map<RecallFailureReason, Integer> aggregateFailures(List<RecallFailure> failures) {
        final var counts = new EnumMap<RecallFailureReason, Integer>(RecallFailureReason.class);
        failures.forEach(failure -> counts.merge(failure.getReason(), 1, Integer::sum));
        return counts;
    }

    /**
     * @param queryResults One list of results per query issued in the period
     */
    public SLOReport generate(Instant periodStart,
                              Instant periodEnd,
                              List<List<MemoryResult>> queryResults,
                              List<RecallFailure> failures,
                              int crossSessionAttempts,
                              int crossSessionSuccesses,
                              List<SLOComplianceStatus> namespaceCompliance,
                              Double avgDriftScore) {
        int fresh = 0;
        int relevant = 0;
        int successful = 0;
        int resultCount = 0;
        double totalStaleness = 0;
        for (final var results : queryResults) {
            if (!results.isEmpty()) {
                successful++;
            }
            if (results.stream().anyMatch(result -> !result.isStale())) {
                fresh++;
            }
            if (results.stream().anyMatch(result -> result.getSemanticSimilarity() >= slo.getRelevanceThreshold())) {
                relevant++;
            }
            for (final var result : results) {
                resultCount++;
                totalStaleness += result.getStalenessScore();
            }
        }
        return SLOReport.builder()
                .reportId("slo_" + UUID.randomUUID())
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .totalQueries(queryResults.size())
                .freshQueries(fresh)
                .relevantQueries(relevant)
                .successfulRecalls(successful)
                .crossSessionAttempts(crossSessionAttempts)
                .crossSessionSuccesses(crossSessionSuccesses)
                .totalFailures(failures.size())
                .failuresByReason(aggregateFailures(failures))
                .avgStalenessScore(resultCount > 0 ? totalStaleness / resultCount : 0)
                .avgDriftScore(avgDriftScore)
                .namespaceCompliance(namespaceCompliance)
                .generatedAt(clock.instant())
                .build();
    }

    public static String format(SLOReport report) {
        final var out = new StringBuilder();
        line(out, RULE);
        line(out, "SLO COMPLIANCE REPORT");
        line(out, "Period: %s to %s".formatted(DATE.format(report.getPeriodStart()),
                                             DATE.format(report.getPeriodEnd())));
        line(out, RULE);
        line(out, "%-22s %8d".formatted("Total Queries:", report.getTotalQueries()));
        line(out, "%-22s %7s%%".formatted("Freshness Rate:",
                                         percent(report.getFreshQueries(), report.getTotalQueries())));
        line(out, "%-22s %7s%%".formatted("Relevance Rate:",
                                         percent(report.getRelevantQueries(), report.getTotalQueries())));
        line(out, "%-22s %7s%%".formatted("Recall Success:",
                                         percent(report.getSuccessfulRecalls(), report.getTotalQueries())));
        line(out, "%-22s %7s%%".formatted("Cross-Session:",
                                         percent(report.getCrossSessionSuccesses(),
                                                 report.getCrossSessionAttempts())));
        line(out, String.format(Locale.ROOT, "%-22s %8.3f", "Avg Staleness:", report.getAvgStalenessScore()));
        if (report.getAvgDriftScore() != null) {
            line(out, String.format(Locale.ROOT, "%-22s %8.3f", "Avg Drift:", report.getAvgDriftScore()));
        }
        line(out, RULE);
        if (report.getTotalFailures() > 0) {
            line(out, "FAILURES: " + report.getTotalFailures());
            report.getFailuresByReason()
                    .forEach((reason, count) -> line(out, "  %-30s %5d".formatted(
                            reason.name().toLowerCase(Locale.ROOT), count)));
            line(out, RULE);
        }
        if (!report.getNamespaceCompliance().isEmpty()) {
            line(out, "NAMESPACE COMPLIANCE");
            for (final var ns : report.getNamespaceCompliance()) {
                line(out, String.format(Locale.ROOT, "%s %-40s %3.0f%% fresh",
                                        ns.isCompliant() ? "[OK]  " : "[FAIL]",
                                        ns.getNamespaceKey(),
                                        ns.getFreshnessCompliancePercent()));
                ns.getViolations()
                        .forEach(violation -> line(out, "    - [%s] %s".formatted(violation.getSeverity(),
                                                                                 violation.getDescription())));
            }
        }
        out.append(RULE);
        return out.toString();
    }

    private static String percent(int numerator, int denominator) {
        return denominator > 0
               ? String.format(Locale.ROOT, "%.1f", (numerator * 100.0) / denominator)
               : "100.0";
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
