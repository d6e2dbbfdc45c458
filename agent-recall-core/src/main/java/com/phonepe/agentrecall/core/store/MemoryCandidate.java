package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.model.MemoryObject;
import lombok.Value;

/**
 * A memory matched by a store search along with its semantic similarity to the query, in [0,1]
 */
@Value
public class MemoryCandidate {
    MemoryObject memory;
    double semanticSimilarity;

    public static MemoryCandidate of(MemoryObject memory, double semanticSimilarity) {
        return new MemoryCandidate(memory, Math.max(0, Math.min(1, semanticSimilarity)));
    }
}
