package com.quarry.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Optional;

/**
 * Parsing and formatting of timestamp literals used in conditions and extensions.
 *
 * Timestamps are second-granular UTC instants. Strings without an offset are read as UTC.
 */
public final class DateTimes {

    private static final DateTimeFormatter ISO_FORMATTER =
            DateTimeFormatter.ISO_LOCAL_DATE_TIME.withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter SQL_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    // 2020-01-01, 2020-01-01T10:00:00, 2020-01-01 10:00:00.123, 2020-01-01T10:00:00+02:00
    private static final DateTimeFormatter LENIENT_FORMATTER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalEnd()
            .toFormatter();

    private DateTimes() {
        throw new UnsupportedOperationException("DateTimes is a utility class and cannot be instantiated");
    }

    /**
     * Parse a timestamp literal and truncate it to the second
     */
    public static Instant parse(Object value) {
        return parse(value, 1);
    }

    /**
     * Parse a timestamp literal and align it down to a multiple of {@code alignSeconds}
     *
     * @throws IllegalArgumentException if the value is not a recognised timestamp
     */
    public static Instant parse(Object value, int alignSeconds) {
        if (alignSeconds <= 0) {
            throw new IllegalArgumentException("alignSeconds must be positive, got " + alignSeconds);
        }
        Instant instant = toInstant(value);
        long seconds = instant.getEpochSecond();
        return Instant.ofEpochSecond(seconds - Math.floorMod(seconds, (long) alignSeconds));
    }

    /**
     * Parse a string literal, empty when it is not a timestamp
     */
    public static Optional<Instant> tryParse(String value) {
        try {
            return Optional.of(parseString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * ISO-8601 local form in UTC, e.g. {@code 2020-01-01T10:00:00}
     */
    public static String format(Instant instant) {
        return ISO_FORMATTER.format(instant);
    }

    /**
     * ClickHouse DateTime form in UTC, e.g. {@code 2020-01-01 10:00:00}
     */
    public static String formatSql(Instant instant) {
        return SQL_FORMATTER.format(instant);
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        } else if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        } else if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        } else if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        } else if (value instanceof Date) {
            return ((Date) value).toInstant();
        } else if (value instanceof Number) {
            return Instant.ofEpochSecond(((Number) value).longValue());
        } else if (value instanceof String) {
            return parseString((String) value);
        }
        throw new IllegalArgumentException("Not a timestamp: " + value);
    }

    private static Instant parseString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Not a timestamp: " + value);
        }
        TemporalAccessor parsed;
        try {
            parsed = LENIENT_FORMATTER.parseBest(value.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a timestamp: " + value, e);
        }
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        } else if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
