package com.phonepe.agentrecall.core.freshness;

import com.phonepe.agentrecall.core.MutableClock;
import com.phonepe.agentrecall.core.TestUtils;
import com.phonepe.agentrecall.core.recall.MemoryResult;
import com.phonepe.agentrecall.core.recall.RecallFailure;
import com.phonepe.agentrecall.core.recall.RecallFailureReason;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SLOComplianceEvaluatorTest {
    private static final double DELTA = 1e-6;

    private final MutableClock clock = new MutableClock();
    private final SLOComplianceEvaluator evaluator = new SLOComplianceEvaluator(SLOConfig.DEFAULT, clock);

    @Test
    void testAllFreshAndRelevant() {
        final var results = List.of(result(0.1, false, 0.9), result(0.2, false, 0.5));
        final var status = evaluator.evaluateNamespaceCompliance(TestUtils.NAMESPACE, results, List.of(), 0, 0);
        assertTrue(status.isCompliant());
        assertEquals(100, status.getFreshnessCompliancePercent(), DELTA);
        assertEquals(100, status.getRelevanceCompliancePercent(), DELTA);
        assertEquals(100, status.getRecallCompliancePercent(), DELTA);
        assertEquals(100, status.getCrossSessionSuccessPercent(), DELTA);
        assertEquals(TestUtils.NAMESPACE.key(), status.getNamespaceKey());
        assertEquals(clock.instant(), status.getEvaluatedAt());
        assertTrue(status.getViolations().isEmpty());
    }

    @Test
    void testFreshnessWarning() {
        final var results = new ArrayList<MemoryResult>();
        for (int i = 0; i < 9; i++) {
            results.add(result(0.1, false, 0.9));
        }
        results.add(result(1.0, true, 0.9));
        final var evaluation = evaluator.evaluateFreshness(results);
        assertEquals(90, evaluation.compliancePercent(), DELTA);
        assertEquals(0.19, evaluation.getAverageStaleness(), DELTA);
        assertEquals(1, evaluation.getViolations().size());
        final var violation = evaluation.getViolations().get(0);
        assertEquals(SLOType.FRESHNESS, violation.getSloType());
        assertEquals(ViolationSeverity.WARNING, violation.getSeverity());
        assertEquals("Freshness compliance at 90.0%, target is 95%", violation.getDescription());
    }

    @Test
    void testRelevanceCritical() {
        final var results = List.of(result(0.1, false, 0.1), result(0.1, false, 0.9));
        final var evaluation = evaluator.evaluateRelevance(results);
        assertEquals(50, evaluation.compliancePercent(), DELTA);
        assertEquals(ViolationSeverity.CRITICAL, evaluation.getViolations().get(0).getSeverity());
        assertEquals(SLOType.RELEVANCE, evaluation.getViolations().get(0).getSloType());
    }

    @Test
    void testNothingRecalled() {
        final var failures = List.of(RecallFailure.of(RecallFailureReason.NO_MATCHES, "refund policy",
                                                      TestUtils.NAMESPACE.key(), null, 0, clock.instant()));
        final var status = evaluator.evaluateNamespaceCompliance(TestUtils.NAMESPACE, List.of(), failures, 0, 0);
        assertFalse(status.isCompliant());
        assertEquals(0, status.getRecallCompliancePercent(), DELTA);
        assertEquals(1, status.getFailureCount());
        assertEquals(1, status.getViolations().size());
        assertEquals(SLOType.RECALL, status.getViolations().get(0).getSloType());
    }

    @Test
    void testCrossSessionSeverity() {
        final var results = List.of(result(0.1, false, 0.9));
        final var warning = evaluator.evaluateNamespaceCompliance(TestUtils.NAMESPACE, results, List.of(), 10, 8);
        assertEquals(80, warning.getCrossSessionSuccessPercent(), DELTA);
        assertEquals(ViolationSeverity.WARNING, warning.getViolations().get(0).getSeverity());
        assertEquals(SLOType.CROSS_SESSION, warning.getViolations().get(0).getSloType());

        final var critical = evaluator.evaluateNamespaceCompliance(TestUtils.NAMESPACE, results, List.of(), 10, 5);
        assertEquals(ViolationSeverity.CRITICAL, critical.getViolations().get(0).getSeverity());
    }

    @Test
    void testEmptyBatchIsNotAViolation() {
        final var evaluation = evaluator.evaluateFreshness(List.of());
        assertEquals(0, evaluation.getTotal());
        assertEquals(100, evaluation.compliancePercent(), DELTA);
        assertTrue(evaluation.getViolations().isEmpty());
    }

    static MemoryResult result(double staleness, boolean stale, double similarity) {
        return MemoryResult.builder()
                .memoryId(UUID.randomUUID().toString())
                .content("Escalate refunds above 500 to a human")
                .stalenessScore(staleness)
                .stale(stale)
                .semanticSimilarity(similarity)
                .build();
    }
}
