package com.phonepe.agentrecall.core.validation;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits applied to content at ingestion time
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class MemoryValidationConfig {
    public static final MemoryValidationConfig DEFAULT = MemoryValidationConfig.builder().build();

    @Builder.Default
    int maxEntryLength = 16_000;
    /**
     * Entries scoring below this confidence are quarantined
     */
    @Builder.Default
    double quarantineThreshold = 0.45;
    @Builder.Default
    int maxJsonDepth = 12;
    @Builder.Default
    int maxJsonNodes = 5_000;
    @Builder.Default
    int maxJsonKeys = 1_000;
    @Builder.Default
    int maxJsonArrayItems = 2_000;
    @Builder.Default
    int maxJsonStringLength = 4_000;

    public List<String> validate() {
        final var errors = new ArrayList<String>();
        if (maxEntryLength <= 0) {
            errors.add("max_entry_length must be positive");
        }
        if (quarantineThreshold < 0 || quarantineThreshold > 1) {
            errors.add("quarantine_threshold must be between 0 and 1");
        }
        if (maxJsonDepth <= 0 || maxJsonNodes <= 0 || maxJsonKeys <= 0
                || maxJsonArrayItems <= 0 || maxJsonStringLength <= 0) {
            errors.add("JSON structure limits must be positive");
        }
        return errors;
    }
}
