package com.phonepe.agentrecall.core.config;

import com.phonepe.agentrecall.core.drift.DriftThresholds;
import com.phonepe.agentrecall.core.ranking.RankingWeights;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentRecallConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final AgentRecallConfigLoader loader = new AgentRecallConfigLoader();

    @Test
    void testMissingFileGivesDefaults() {
        assertSame(AgentRecallConfig.DEFAULT, loader.load(tempDir.resolve("absent.json")));
        assertSame(AgentRecallConfig.DEFAULT, loader.loadResource("absent.json"));
    }

    @Test
    void testPartialDocumentKeepsDefaults() {
        final var config = loader.loadResource("agent-recall-test.json");
        assertEquals(0.5, config.getRankingWeights().getTaskCriticality());
        assertEquals(720, config.getSlo().getFreshness().getMaxAgeHours());
        assertEquals(0.4, config.getSlo().getFreshness().getRelevanceThreshold());
        assertEquals(95, config.getSlo().getFreshness().getRecallTargetPercent());
        assertTrue(config.getSlo().isEnabled());
        assertEquals(200, config.getExpiryBatchSize());
        assertEquals(10, config.getDefaultSearchLimit());
        assertEquals(DriftThresholds.DEFAULT, config.getDriftThresholds());
        assertTrue(loader.validate(config).isEmpty());
    }

    @Test
    void testSaveAndLoad() {
        final var config = AgentRecallConfig.builder()
                .rankingWeights(RankingWeights.DEFAULT.withImportance(0.3))
                .searchTimeout(Duration.ofSeconds(2))
                .defaultSearchLimit(25)
                .build();
        final var path = tempDir.resolve("nested/dir/agent-recall.json");
        loader.save(config, path);
        assertTrue(Files.exists(path));
        assertEquals(config, loader.loadValidated(path));
    }

    @Test
    @SneakyThrows
    void testInvalidConfigListsEveryProblem() {
        final var path = tempDir.resolve("bad.json");
        Files.writeString(path, """
                {
                  "rankingWeights": { "importance": -1 },
                  "driftThresholds": { "maxDriftScore": 2 },
                  "expiryBatchSize": 0
                }
                """);
        final var error = assertThrows(IllegalArgumentException.class, () -> loader.loadValidated(path));
        assertTrue(error.getMessage().startsWith("Invalid configuration in " + path));
        assertTrue(error.getMessage().contains("ranking weights must be non-negative"));
        assertTrue(error.getMessage().contains("max_drift_score must be between 0 and 1"));
        assertTrue(error.getMessage().contains("expiry_batch_size must be positive"));
    }
}
