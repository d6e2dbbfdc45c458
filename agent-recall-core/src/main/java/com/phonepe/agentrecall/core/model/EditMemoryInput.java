package com.phonepe.agentrecall.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Partial update of a memory. Fields left null are not touched.
 */
@Value
@Builder
@Jacksonized
public class EditMemoryInput {
    String content;
    String contentType;
    List<String> tags;
    Double importance;
    Double taskCriticality;
    float[] embedding;

    @JsonIgnore
    public boolean isEmpty() {
        return content == null
                && contentType == null
                && tags == null
                && importance == null
                && taskCriticality == null
                && embedding == null;
    }
}
