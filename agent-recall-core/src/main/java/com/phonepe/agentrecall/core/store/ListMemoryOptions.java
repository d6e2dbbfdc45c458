package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.model.MemoryStatus;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Filters and paging for listing memories in the primary partition
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class ListMemoryOptions {
    /**
     * Only return memories with this status. All statuses when null.
     */
    MemoryStatus status;
    /**
     * Include memories whose TTL or expiry timestamp has passed
     */
    boolean includeExpired;
    @Builder.Default
    int limit = ListOptions.DEFAULT_LIMIT;
    int offset;
    @Builder.Default
    SortOrder order = SortOrder.DESC;

    public static ListMemoryOptions active() {
        return ListMemoryOptions.builder()
                .status(MemoryStatus.ACTIVE)
                .limit(Integer.MAX_VALUE)
                .build();
    }
}
