package com.libragraph.archive.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Parsing of the timestamps embedded in acquisition and file names.
 *
 * <p>Acquisition timestamps are ISO-8601 basic UTC instants, {@code YYYYMMDDTHHMMSSZ}.
 * Parsing is strict: no offsets other than the literal {@code Z}, no lenient
 * field rollover (e.g. month 13 or hour 24 are rejected).
 */
public final class AcqTimestamp {

    public static final int LENGTH = 16;

    private static final DateTimeFormatter ACQ_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd'T'HHmmss'Z'")
                    .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd")
                    .withResolverStyle(ResolverStyle.STRICT);

    private AcqTimestamp() {}

    /**
     * Parses a {@code YYYYMMDDTHHMMSSZ} string.
     *
     * @throws DateTimeParseException if {@code text} is not exactly that form
     */
    public static Instant parse(String text) {
        if (text == null || text.length() != LENGTH) {
            throw new DateTimeParseException("Expected " + LENGTH + " characters", String.valueOf(text), 0);
        }
        return LocalDateTime.parse(text, ACQ_FORMAT).toInstant(ZoneOffset.UTC);
    }

    /** Like {@link #parse(String)} but returns empty instead of throwing. */
    public static Optional<Instant> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Formats an instant back into acquisition-name form. */
    public static String format(Instant instant) {
        return ACQ_FORMAT.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    /**
     * Parses an eight-digit {@code YYYYMMDD} date.
     *
     * @throws DateTimeParseException if {@code text} is not a valid calendar date
     */
    public static LocalDate parseDate(String text) {
        if (text == null || text.length() != 8) {
            throw new DateTimeParseException("Expected 8 digits", String.valueOf(text), 0);
        }
        return LocalDate.parse(text, DATE_FORMAT);
    }

    /** Seconds since the epoch of midnight UTC on {@code date}. */
    public static long startOfDay(LocalDate date) {
        return date.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
    }

    /** Seconds since the epoch of 23:59:59 UTC on {@code date}. */
    public static long endOfDay(LocalDate date) {
        return date.atTime(LocalTime.of(23, 59, 59)).toEpochSecond(ZoneOffset.UTC);
    }
}
