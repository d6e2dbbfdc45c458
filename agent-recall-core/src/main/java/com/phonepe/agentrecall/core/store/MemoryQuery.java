package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.model.SourceType;
import com.phonepe.agentrecall.core.ranking.RankingWeights;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * Query for ranked memory retrieval
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class MemoryQuery {
    @NonNull
    Namespace namespace;

    /**
     * Free text. Drives semantic similarity when present.
     */
    String query;

    /**
     * Embedding of the query text, if the caller has one
     */
    float[] queryEmbedding;

    /**
     * Every tag must be present on a matching memory
     */
    List<String> tags;

    Set<SourceType> sourceTypes;

    Double minImportance;

    /**
     * Results below this similarity are dropped when the query carries text or an embedding
     */
    Double minSemanticSimilarity;

    /**
     * Maximum effective age (most recent of creation and last access) of a result
     */
    Long maxAgeSeconds;

    /**
     * Drop results that breach the freshness SLO
     */
    boolean excludeStale;

    Integer limit;

    @Builder.Default
    boolean includeContent = true;

    /**
     * Overrides the configured ranking weights
     */
    RankingWeights rankingWeights;

    /**
     * Restrict to memories from this session unless {@link #includeCrossSession} is set
     */
    String sessionId;

    boolean includeCrossSession;

    /**
     * Session on whose behalf the query runs, used for cross-session accounting
     */
    String currentSessionId;

    /**
     * Record an access on every returned memory
     */
    boolean recordAccess;

    public boolean hasSemanticSignal() {
        return (query != null && !query.isBlank()) || (queryEmbedding != null && queryEmbedding.length > 0);
    }
}
