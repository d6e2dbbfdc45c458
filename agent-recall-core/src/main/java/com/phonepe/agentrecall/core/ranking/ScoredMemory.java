package com.phonepe.agentrecall.core.ranking;

import com.phonepe.agentrecall.core.model.MemoryObject;
import lombok.Value;

/**
 * A memory together with its composite score and the raw similarity it was scored with
 */
@Value
public class ScoredMemory {
    MemoryObject memory;
    double score;
    double semanticSimilarity;
    double recency;
    ScoreComponents components;
}
