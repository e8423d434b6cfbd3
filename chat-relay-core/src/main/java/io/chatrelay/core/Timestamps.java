package io.chatrelay.core;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * ISO-8601 timestamp helpers shared by codecs and stores.
 *
 * <p>Stores report instants in several shapes: {@code 2025-01-01T10:00:00Z},
 * {@code 2025-01-01T10:00:00.123456+00:00} (Postgres {@code timestamptz}) and zone-less
 * {@code 2025-01-01T10:00:00} ({@code timestamp}); zone-less values are read as UTC.
 */
public final class Timestamps {
    private Timestamps() {}

    private static final DateTimeFormatter LENIENT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter();

    public static String format(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    /**
     * @return the parsed instant, or {@code null} for a null or blank value
     * @throws IllegalArgumentException if the value is not an ISO-8601 date-time
     */
    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            TemporalAccessor parsed = LENIENT.parseBest(raw.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid timestamp: " + raw, e);
        }
    }
}
