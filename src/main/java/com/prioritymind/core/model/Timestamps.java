package com.prioritymind.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient parsing of stored timestamps. Unparsable input yields an empty result
 * instead of an exception so derived values (ages, weights) can degrade quietly.
 */
public final class Timestamps {

    private static final Logger log = LoggerFactory.getLogger(Timestamps.class);

    /** ISO instants, offset date-times, then plain dates taken as UTC midnight. */
    private static final List<Function<String, Instant>> FORMATS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private Timestamps() {}

    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        DateTimeParseException lastError = null;
        for (var format : FORMATS) {
            try {
                return Optional.of(format.apply(trimmed));
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("Unparsable timestamp '{}': {}", trimmed, lastError.getMessage());
        return Optional.empty();
    }

    /** Hours from {@code from} to {@code now}, never negative. */
    public static double ageHours(Instant from, Instant now) {
        return Math.max(0, Duration.between(from, now).toMillis() / 3_600_000.0);
    }
}
