package com.phonepe.agentrecall.core.recall;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Why a search produced nothing useful, with a fixed message and remediation hints
 */
@Getter
@AllArgsConstructor
public enum RecallFailureReason {
    NO_MATCHES("No memories matched the query",
               List.of("Try a broader query", "Check if memories exist in this namespace")),
    ALL_STALE("All matching memories are stale (exceeded freshness SLO)",
              List.of("Refresh memories with updated content", "Increase freshness SLO max_age_hours")),
    BELOW_RELEVANCE_THRESHOLD("No memories met the relevance threshold",
                              List.of("Lower the relevance threshold", "Add more specific tags to memories")),
    CROSS_SESSION_UNAVAILABLE("Cross-session memories could not be retrieved",
                              List.of("Ensure cross-session tracking is enabled", "Check session history")),
    STORAGE_ERROR("Storage backend returned an error",
                  List.of("Check storage backend connectivity", "Review error logs")),
    TIMEOUT("Memory retrieval timed out",
            List.of("Reduce query scope", "Check system load")),
    EMBEDDING_UNAVAILABLE("Vector embeddings are not available for semantic search",
                          List.of("Enable vector embeddings", "Use tag-based search instead")),
    NAMESPACE_NOT_FOUND("The specified namespace does not exist",
                        List.of("Verify namespace configuration", "Initialize the namespace")),
    QUOTA_EXCEEDED("Memory quota has been exceeded",
                   List.of("Delete old memories", "Upgrade storage quota")),
    ;

    private final String message;
    private final List<String> suggestions;
}
