package com.healthwatch.statusmodel;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Parsing and formatting of the ISO-8601 date-time strings carried by {@link StatusRecord}.
 * <p>
 * Accepted input is a full local date-time ({@code 2024-01-15T10:30:00}, fraction optional)
 * with an optional offset ({@code Z}, {@code +02:00}). A bare date is rejected. A value without
 * an offset is interpreted as UTC.
 */
public final class Timestamps {

    private static final DateTimeFormatter LENIENT_ISO = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter();

    private Timestamps() {
        // utility class
    }

    /**
     * Returns true if the value parses as a full date-time.
     */
    public static boolean isValid(String value) {
        return parse(value).isPresent();
    }

    /**
     * Parses a timestamp into an instant.
     *
     * @param value the timestamp string, may be null
     * @return the instant, or empty if the value is null, blank or malformed
     */
    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = LENIENT_ISO.parseBest(
                    value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Formats the current instant of the given clock as UTC ISO-8601 with a {@code Z} suffix.
     */
    public static String now(Clock clock) {
        return Instant.now(clock).toString();
    }

    /**
     * Formats the current system time as UTC ISO-8601 with a {@code Z} suffix.
     */
    public static String now() {
        return now(Clock.systemUTC());
    }
}
