package com.phonepe.agentrecall.core.recall;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Structured explanation returned instead of a silent empty result
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class RecallFailure {
    @NonNull
    String failureId;
    @NonNull
    RecallFailureReason reason;
    String message;
    String query;
    String namespaceKey;
    String sessionId;
    Instant timestamp;
    Integer filteredCount;
    @Singular
    List<String> suggestions;

    public static RecallFailure of(RecallFailureReason reason,
                                   String query,
                                   String namespaceKey,
                                   String sessionId,
                                   Integer filteredCount,
                                   Instant timestamp) {
        return RecallFailure.builder()
                .failureId("rf_" + UUID.randomUUID())
                .reason(reason)
                .message(reason.getMessage())
                .query(query)
                .namespaceKey(namespaceKey)
                .sessionId(sessionId)
                .timestamp(timestamp)
                .filteredCount(filteredCount)
                .suggestions(reason.getSuggestions())
                .build();
    }
}
