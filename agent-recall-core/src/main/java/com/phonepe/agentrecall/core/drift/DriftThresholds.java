package com.phonepe.agentrecall.core.drift;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class DriftThresholds {
    public static final DriftThresholds DEFAULT = DriftThresholds.builder().build();

    @Builder.Default
    double maxDriftScore = 0.4;
    @Builder.Default
    double minCoherenceScore = 0.6;
    @Builder.Default
    double maxFragmentationScore = 0.3;

    public List<String> validate() {
        final var errors = new ArrayList<String>();
        check(errors, "max_drift_score", maxDriftScore);
        check(errors, "min_coherence_score", minCoherenceScore);
        check(errors, "max_fragmentation_score", maxFragmentationScore);
        return errors;
    }

    private static void check(List<String> errors, String name, double value) {
        if (value < 0 || value > 1) {
            errors.add(name + " must be between 0 and 1");
        }
    }
}
