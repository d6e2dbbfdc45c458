package com.phonepe.agentrecall.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Verdict of the ingestion validator, captured once when the memory is created. Only the quarantine flag changes
 * afterwards.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class IngestionMetadata {
    SourceType sourceType;
    String sourceId;
    Instant ingestionTimestamp;
    double confidenceScore;
    ContentFormat detectedFormat;
    @Singular
    List<String> anomalyFlags;
    boolean quarantined;
    @Singular
    List<String> validationNotes;
}
