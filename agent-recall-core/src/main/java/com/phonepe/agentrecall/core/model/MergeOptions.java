package com.phonepe.agentrecall.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Overrides for the combined attributes of a merged memory. By default tags are the union of the sources and
 * scores are the arithmetic mean.
 */
@Value
@Builder
@Jacksonized
public class MergeOptions {
    public static final MergeOptions DEFAULT = MergeOptions.builder().build();

    List<String> tags;
    Double importance;
    Double taskCriticality;
}
