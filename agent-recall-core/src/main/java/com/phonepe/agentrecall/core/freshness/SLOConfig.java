package com.phonepe.agentrecall.core.freshness;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * SLO monitoring settings for a namespace
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class SLOConfig {
    public static final SLOConfig DEFAULT = SLOConfig.builder().build();

    @Builder.Default
    FreshnessSLO freshness = FreshnessSLO.DEFAULT;
    @Builder.Default
    boolean enabled = true;
    /**
     * Alert when violations exceed this percentage
     */
    @Builder.Default
    double alertThresholdPercent = 10;
    @Builder.Default
    int evaluationIntervalMinutes = 60;

    /**
     * @return Problems with this configuration, empty when valid
     */
    public List<String> validate() {
        final var errors = new ArrayList<String>();
        if (freshness == null) {
            errors.add("freshness SLO is required");
        }
        else {
            if (freshness.getMaxAgeHours() <= 0) {
                errors.add("max_age_hours must be positive");
            }
            if (freshness.getRelevanceThreshold() < 0 || freshness.getRelevanceThreshold() > 1) {
                errors.add("relevance_threshold must be between 0 and 1");
            }
            if (freshness.getRecallTargetPercent() < 0 || freshness.getRecallTargetPercent() > 100) {
                errors.add("recall_target_percent must be between 0 and 100");
            }
        }
        if (alertThresholdPercent < 0 || alertThresholdPercent > 100) {
            errors.add("alert_threshold_percent must be between 0 and 100");
        }
        if (evaluationIntervalMinutes <= 0) {
            errors.add("evaluation_interval_minutes must be positive");
        }
        return errors;
    }
}
