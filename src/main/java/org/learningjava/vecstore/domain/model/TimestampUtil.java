package org.learningjava.vecstore.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * Recognizes timestamp values and renders them in their canonical ISO-8601 form.
 * The backend has no timestamp column type, so timestamps are stored and filtered as text.
 */
public final class TimestampUtil {

    private TimestampUtil() {
    }

    public static boolean isTimestamp(Object value) {
        return value instanceof Instant
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof LocalDateTime
                || value instanceof LocalDate
                || value instanceof Date;
    }

    public static String format(Object value) {
        if (value instanceof Instant i) return DateTimeFormatter.ISO_INSTANT.format(i);
        if (value instanceof OffsetDateTime o) return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(o);
        if (value instanceof ZonedDateTime z) return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(z);
        if (value instanceof LocalDateTime l) return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(l);
        if (value instanceof LocalDate d) return DateTimeFormatter.ISO_LOCAL_DATE.format(d);
        // java.sql.Date#toInstant throws, go through epoch millis instead
        if (value instanceof Date d) return DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(d.getTime()));
        throw new IllegalArgumentException("Not a timestamp: " + (value == null ? "null" : value.getClass().getName()));
    }
}
