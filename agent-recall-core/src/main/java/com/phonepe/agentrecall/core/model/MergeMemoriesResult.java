package com.phonepe.agentrecall.core.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a merge
 */
@Value
public class MergeMemoriesResult {
    MemoryObject mergedMemory;
    List<String> mergedIds;
}
