package com.phonepe.agentrecall.core.validation;

import com.phonepe.agentrecall.core.model.SourceType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class MemoryValidationInput {
    @NonNull
    String content;
    @NonNull
    SourceType sourceType;
    @NonNull
    String sourceId;
    /**
     * Content type claimed by the caller. Takes precedence over detection.
     */
    String declaredContentType;
}
