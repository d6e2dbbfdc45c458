package com.phonepe.agentrecall.core.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of an expiry sweep
 */
@Value
public class ExpireMemoriesResult {
    int expiredCount;
    List<String> expiredIds;

    public static ExpireMemoriesResult of(List<String> expiredIds) {
        return new ExpireMemoriesResult(expiredIds.size(), List.copyOf(expiredIds));
    }
}
