package com.phonepe.agentrecall.core.store;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Paging options for list operations
 */
@Value
@Builder
@Jacksonized
public class ListOptions {
    public static final int DEFAULT_LIMIT = 100;

    @Builder.Default
    int limit = DEFAULT_LIMIT;
    int offset;
    @Builder.Default
    SortOrder order = SortOrder.DESC;

    public static ListOptions defaults() {
        return ListOptions.builder().build();
    }
}
