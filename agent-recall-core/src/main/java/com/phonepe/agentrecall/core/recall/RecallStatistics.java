package com.phonepe.agentrecall.core.recall;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller owned accumulator of search outcomes, used as input for SLO evaluation and reporting. Safe for use from
 * multiple threads.
 */
public class RecallStatistics {
    private final List<List<MemoryResult>> queryResults = new ArrayList<>();
    private final List<RecallFailure> failures = new ArrayList<>();
    private int crossSessionAttempts;
    private int crossSessionSuccesses;

    public synchronized void record(MemorySearchResponse response) {
        queryResults.add(List.copyOf(response.getResults()));
        failures.addAll(response.getFailures());
        if (response.isCrossSessionAttempted()) {
            crossSessionAttempts++;
            if (response.isCrossSessionSuccess()) {
                crossSessionSuccesses++;
            }
        }
    }

    public synchronized List<List<MemoryResult>> queryResults() {
        return List.copyOf(queryResults);
    }

    /**
     * All results of all recorded queries, flattened
     */
    public synchronized List<MemoryResult> results() {
        return queryResults.stream().flatMap(List::stream).toList();
    }

    public synchronized List<RecallFailure> failures() {
        return List.copyOf(failures);
    }

    public synchronized int crossSessionAttempts() {
        return crossSessionAttempts;
    }

    public synchronized int crossSessionSuccesses() {
        return crossSessionSuccesses;
    }

    public synchronized void reset() {
        queryResults.clear();
        failures.clear();
        crossSessionAttempts = 0;
        crossSessionSuccesses = 0;
    }
}
