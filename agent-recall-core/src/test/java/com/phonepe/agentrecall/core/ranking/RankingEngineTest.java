package com.phonepe.agentrecall.core.ranking;

import com.phonepe.agentrecall.core.MutableClock;
import com.phonepe.agentrecall.core.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RankingEngineTest {
    private static final double DELTA = 1e-9;

    private final MutableClock clock = new MutableClock();

    @Test
    void testDefaultWeightedScore() {
        final var components = RankingEngine.components(0.9, 0.8, 0.7, 1.0, RankingWeights.DEFAULT);
        assertEquals(0.405, components.getTaskCriticality(), DELTA);
        assertEquals(0.200, components.getSemanticSimilarity(), DELTA);
        assertEquals(0.140, components.getImportance(), DELTA);
        assertEquals(0.100, components.getRecency(), DELTA);
        assertEquals(0.845, components.total(), DELTA);
    }

    @Test
    void testScoreOfFreshMemory() {
        final var engine = new RankingEngine(RankingWeights.DEFAULT, clock);
        final var memory = TestUtils.memory(clock.instant())
                .withTaskCriticality(0.9)
                .withImportance(0.7);
        final var scored = engine.score(memory, 0.8);
        assertEquals(1.0, scored.getRecency(), DELTA);
        assertEquals(0.845, scored.getScore(), DELTA);
    }

    @Test
    void testRecencyHalvesEveryWeek() {
        final var created = clock.instant();
        assertEquals(0.5, RankingEngine.recencyScore(created, null, created.plus(Duration.ofDays(7))), DELTA);
        assertEquals(0.25, RankingEngine.recencyScore(created, null, created.plus(Duration.ofDays(14))), DELTA);
    }

    @Test
    void testAccessBoostIsBounded() {
        final var created = clock.instant();
        final var now = created.plus(Duration.ofDays(7));
        final var withAccess = RankingEngine.recencyScore(created, now, now);
        assertEquals(0.5 + RankingEngine.MAX_ACCESS_BOOST, withAccess, DELTA);

        final var fresh = RankingEngine.recencyScore(now, now, now);
        assertEquals(1.0, fresh, DELTA);
    }

    @Test
    void testRecencyEdges() {
        final var now = clock.instant();
        assertEquals(0.0, RankingEngine.recencyScore(null, now, now), DELTA);
        assertEquals(1.0, RankingEngine.recencyScore(now.plus(Duration.ofHours(1)), null, now), DELTA);
        final var old = now.minus(Duration.ofDays(7));
        assertEquals(0.5, RankingEngine.recencyScore(old, now.plus(Duration.ofHours(1)), now), DELTA);
        for (int days = 0; days < 400; days += 13) {
            final var score = RankingEngine.recencyScore(now.minus(Duration.ofDays(days)),
                                                         now.minus(Duration.ofDays(days / 2)),
                                                         now);
            assertTrue(score >= 0 && score <= 1);
        }
    }

    @Test
    void testCustomWeights() {
        final var engine = new RankingEngine(RankingWeights.DEFAULT, clock);
        final var memory = TestUtils.memory(clock.instant()).withImportance(1.0).withTaskCriticality(0.0);
        final var importanceOnly = RankingWeights.builder()
                .taskCriticality(0)
                .semanticSimilarity(0)
                .importance(1)
                .recencyDecay(0)
                .build();
        assertEquals(1.0, engine.score(memory, 0.3, importanceOnly).getScore(), DELTA);
    }

    @Test
    void testRankOrdersByScoreThenNewest() {
        final var engine = new RankingEngine(RankingWeights.DEFAULT, clock);
        final var older = TestUtils.memory(clock.instant().minus(Duration.ofDays(1)));
        final var newer = TestUtils.memory(clock.instant());
        final var best = TestUtils.memory(clock.instant()).withTaskCriticality(1.0);

        final var tieA = new ScoredMemory(older, 0.5, 0, 0, ScoreComponents.builder().build());
        final var tieB = new ScoredMemory(newer, 0.5, 0, 0, ScoreComponents.builder().build());
        final var top = engine.score(best, 1.0);

        final var ranked = RankingEngine.rank(List.of(tieA, top, tieB));
        assertEquals(best.getMemoryId(), ranked.get(0).getMemory().getMemoryId());
        assertEquals(newer.getMemoryId(), ranked.get(1).getMemory().getMemoryId());
        assertEquals(older.getMemoryId(), ranked.get(2).getMemory().getMemoryId());
    }
}
