package com.phonepe.agentrecall.core.validation;

import com.phonepe.agentrecall.core.model.ContentFormat;
import com.phonepe.agentrecall.core.model.SourceType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Verdict for a candidate memory entry. Rejected entries carry a reason and nothing else of use.
 */
@Value
@Builder
public class MemoryValidationResult {
    boolean accepted;
    boolean quarantined;
    /**
     * Canonical trust bucket of the source
     */
    SourceType sourceType;
    String sourceId;
    String normalizedContent;
    /**
     * One of text, json or markdown. HTML is reduced to text.
     */
    String normalizedContentType;
    ContentFormat detectedFormat;
    double confidenceScore;
    @Singular
    List<String> anomalyFlags;
    @Singular
    List<String> validationNotes;
    String rejectionReason;

    public static MemoryValidationResult rejected(MemoryValidationInput input, String reason) {
        return MemoryValidationResult.builder()
                .accepted(false)
                .sourceType(input.getSourceType().canonical())
                .sourceId(input.getSourceId())
                .normalizedContent("")
                .normalizedContentType("text")
                .detectedFormat(ContentFormat.TEXT)
                .confidenceScore(0)
                .rejectionReason(reason)
                .build();
    }
}
