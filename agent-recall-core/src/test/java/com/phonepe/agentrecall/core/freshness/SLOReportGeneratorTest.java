package com.phonepe.agentrecall.core.freshness;

import com.phonepe.agentrecall.core.MutableClock;
import com.phonepe.agentrecall.core.TestUtils;
import com.phonepe.agentrecall.core.recall.RecallFailure;
import com.phonepe.agentrecall.core.recall.RecallFailureReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.phonepe.agentrecall.core.freshness.SLOComplianceEvaluatorTest.result;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SLOReportGeneratorTest {
    private static final double DELTA = 1e-6;

    private final MutableClock clock = new MutableClock();
    private final SLOReportGenerator generator = new SLOReportGenerator(FreshnessSLO.DEFAULT, clock);

    @Test
    void testGenerate() {
        final var start = clock.instant().minus(Duration.ofDays(1));
        final var failures = List.of(failure(RecallFailureReason.NO_MATCHES),
                                     failure(RecallFailureReason.NO_MATCHES),
                                     failure(RecallFailureReason.ALL_STALE));
        final var report = generator.generate(start,
                                              clock.instant(),
                                              List.of(List.of(result(0.1, false, 0.8), result(1.0, true, 0.1)),
                                                      List.of(result(1.0, true, 0.1)),
                                                      List.of()),
                                              failures,
                                              4,
                                              3,
                                              List.of(),
                                              null);
        assertEquals(3, report.getTotalQueries());
        assertEquals(1, report.getFreshQueries());
        assertEquals(1, report.getRelevantQueries());
        assertEquals(2, report.getSuccessfulRecalls());
        assertEquals(3, report.getTotalFailures());
        assertEquals(2, report.getFailuresByReason().get(RecallFailureReason.NO_MATCHES));
        assertEquals(1, report.getFailuresByReason().get(RecallFailureReason.ALL_STALE));
        assertEquals(0.7, report.getAvgStalenessScore(), DELTA);
        assertNull(report.getAvgDriftScore());
        assertEquals(clock.instant(), report.getGeneratedAt());
        assertTrue(report.getReportId().startsWith("slo_"));
    }

    @Test
    void testFormat() {
        final var evaluator = new SLOComplianceEvaluator(SLOConfig.DEFAULT, clock);
        final var compliance = evaluator.evaluateNamespaceCompliance(TestUtils.NAMESPACE, List.of(), List.of(), 0, 0);
        final var report = generator.generate(clock.instant().minus(Duration.ofDays(7)),
                                              clock.instant(),
                                              List.of(List.of(result(0.1, false, 0.9))),
                                              List.of(failure(RecallFailureReason.TIMEOUT)),
                                              0,
                                              0,
                                              List.of(compliance),
                                              0.25);
        final var text = SLOReportGenerator.format(report);
        assertTrue(text.contains("SLO COMPLIANCE REPORT"));
        assertTrue(text.contains("Period: 2025-12-25 to 2026-01-01"));
        assertTrue(text.contains("Total Queries:"));
        assertTrue(text.contains("Freshness Rate:"));
        assertTrue(text.contains("100.0%"));
        assertTrue(text.contains("Avg Drift:"));
        assertTrue(text.contains("FAILURES: 1"));
        assertTrue(text.contains("timeout"));
        assertTrue(text.contains("NAMESPACE COMPLIANCE"));
        assertTrue(text.contains("[FAIL]"));
        assertTrue(text.contains(TestUtils.NAMESPACE.key()));
    }

    @Test
    void testFormatWithoutFailures() {
        final var report = generator.generate(clock.instant(), clock.instant(), List.of(), List.of(), 0, 0,
                                              List.of(), null);
        final var text = SLOReportGenerator.format(report);
        assertFalse(text.contains("FAILURES"));
        assertFalse(text.contains("Avg Drift:"));
    }

    private RecallFailure failure(RecallFailureReason reason) {
        return RecallFailure.of(reason, "shipping delays", TestUtils.NAMESPACE.key(), "s1", null, clock.instant());
    }
}
