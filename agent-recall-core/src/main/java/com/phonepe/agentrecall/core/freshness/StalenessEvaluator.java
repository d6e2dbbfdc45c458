package com.phonepe.agentrecall.core.freshness;

import com.phonepe.agentrecall.core.model.MemoryObject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Measures how far a memory has progressed towards its maximum allowed age.
 * <p>
 * Staleness grows slowly, up to 0.2, during a grace period of half the maximum age, then linearly from 0.2 to 1.
 */
public class StalenessEvaluator {
    private static final double GRACE_FRACTION = 0.5;
    private static final double GRACE_STALENESS = 0.2;
    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final FreshnessSLO slo;
    private final Clock clock;

    public StalenessEvaluator() {
        this(FreshnessSLO.DEFAULT, Clock.systemUTC());
    }

    public StalenessEvaluator(FreshnessSLO slo, Clock clock) {
        this.slo = Objects.requireNonNullElse(slo, FreshnessSLO.DEFAULT);
        this.clock = clock;
    }

    public static double stalenessScore(double ageHours, FreshnessSLO slo) {
        if (ageHours <= 0) {
            return 0.0;
        }
        if (ageHours >= slo.getMaxAgeHours()) {
            return 1.0;
        }
        final var gracePeriod = slo.getMaxAgeHours() * GRACE_FRACTION;
        if (ageHours <= gracePeriod) {
            return (ageHours / gracePeriod) * GRACE_STALENESS;
        }
        final var remaining = slo.getMaxAgeHours() - gracePeriod;
        return GRACE_STALENESS + ((ageHours - gracePeriod) / remaining) * (1 - GRACE_STALENESS);
    }

    /**
     * Metrics using the more recent of creation and last access as the effective age. A missing creation time is
     * treated as infinitely old.
     */
    public static StalenessMetrics metrics(Instant createdAt, Instant lastAccessedAt, FreshnessSLO slo, Instant now) {
        final var effective = effectiveTimestamp(createdAt, lastAccessedAt);
        final double ageHours = effective == null
                                ? Double.POSITIVE_INFINITY
                                : (now.toEpochMilli() - effective.toEpochMilli()) / MILLIS_PER_HOUR;
        final var ageDays = ageHours / 24;
        final var stale = ageHours >= slo.getMaxAgeHours();
        return StalenessMetrics.builder()
                .stalenessScore(stalenessScore(ageHours, slo))
                .stale(stale)
                .ageHours(ageHours)
                .ageDays(ageDays)
                .staleReason(stale
                             ? "Memory is %d days old (SLO: %d days)"
                                     .formatted((long) Math.floor(ageDays),
                                                (long) Math.floor(slo.getMaxAgeHours() / 24))
                             : null)
                .timeUntilStaleHours(slo.getMaxAgeHours() - ageHours)
                .build();
    }

    public StalenessMetrics evaluate(MemoryObject memory) {
        return metrics(memory.getCreatedAt(), memory.getLastAccessedAt(), slo, clock.instant());
    }

    public FreshnessSLO slo() {
        return slo;
    }

    private static Instant effectiveTimestamp(Instant createdAt, Instant lastAccessedAt) {
        if (createdAt == null) {
            return lastAccessedAt;
        }
        if (lastAccessedAt == null) {
            return createdAt;
        }
        return lastAccessedAt.isAfter(createdAt) ? lastAccessedAt : createdAt;
    }
}
