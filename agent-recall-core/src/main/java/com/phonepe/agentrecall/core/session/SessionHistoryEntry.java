package com.phonepe.agentrecall.core.session;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Memories of a namespace that originated in one session
 */
@Value
@Builder
@Jacksonized
public class SessionHistoryEntry {
    String sessionId;
    String namespaceKey;
    /**
     * Creation time of the earliest memory of the session
     */
    Instant startedAt;
    @Singular
    List<String> memoryIds;
    int memoryCount;
    int crossSessionRecalls;
}
