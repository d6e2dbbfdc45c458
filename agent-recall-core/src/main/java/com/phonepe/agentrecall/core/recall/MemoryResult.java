package com.phonepe.agentrecall.core.recall;

import com.phonepe.agentrecall.core.model.MemorySource;
import com.phonepe.agentrecall.core.model.ProvenanceEntry;
import com.phonepe.agentrecall.core.ranking.ScoreComponents;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One ranked search hit
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MemoryResult {
    String memoryId;
    /**
     * Omitted when the query asked for no content
     */
    String content;
    String contentType;
    double score;
    /**
     * Weighted contribution of each signal to {@link #score}
     */
    ScoreComponents scoreComponents;
    /**
     * Unweighted semantic similarity reported by the store
     */
    double semanticSimilarity;
    double stalenessScore;
    boolean stale;
    double ageDays;
    double ageHours;
    String staleReason;
    double timeUntilStaleHours;
    String sessionId;
    /**
     * Originated in a session other than the one running the query
     */
    boolean crossSession;
    @Singular
    List<String> tags;
    MemorySource source;
    @Singular("provenanceEntry")
    List<ProvenanceEntry> provenance;
}
