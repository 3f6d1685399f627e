package com.prioritymind.core.reflection;

import com.prioritymind.core.model.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Step-decayed influence of a reflection by age: full weight for the first week,
 * half for the second, a quarter afterwards.
 */
public final class RecencyWeights {

    public static final double FRESH = 1.0;
    public static final double AGING = 0.5;
    public static final double OLD = 0.25;

    /** Weight used when a reflection's timestamp cannot be read. */
    public static final double UNKNOWN_AGE = OLD;

    private RecencyWeights() {}

    /**
     * Whole days elapsed since {@code createdAt}, or empty when the timestamp does not parse.
     */
    public static Optional<Long> ageInDays(String createdAt, Clock clock) {
        return Timestamps.parse(createdAt).map(created -> ageInDays(created, clock.instant()));
    }

    static long ageInDays(Instant createdAt, Instant now) {
        return Math.max(0, Duration.between(createdAt, now).toDays());
    }

    public static double forAgeInDays(long days) {
        if (days <= 7) {
            return FRESH;
        }
        if (days <= 14) {
            return AGING;
        }
        return OLD;
    }

    /**
     * Recency weight for a stored timestamp; an unreadable timestamp gets {@link #UNKNOWN_AGE}.
     */
    public static double weightOf(String createdAt, Clock clock) {
        return ageInDays(createdAt, clock).map(RecencyWeights::forAgeInDays).orElse(UNKNOWN_AGE);
    }
}
