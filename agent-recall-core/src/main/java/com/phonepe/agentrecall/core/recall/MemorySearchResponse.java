package com.phonepe.agentrecall.core.recall;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Ranked results of a search together with the reasons, if any, why nothing useful came back
 */
@Value
@Builder
@Jacksonized
public class MemorySearchResponse {
    @Singular
    List<MemoryResult> results;
    @Singular
    List<RecallFailure> failures;
    int totalCandidates;
    int staleFiltered;
    int relevanceFiltered;
    boolean crossSessionAttempted;
    boolean crossSessionSuccess;
    long queryTimeMs;
}
