/* (C)2026 */
package com.ammann.trustlens.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.function.Function;

/**
 * Lenient timestamp parsing for tabular content.
 *
 * <p>Accepted forms, tried in order: ISO-8601 instant ({@code 2025-09-09T10:15:30Z}),
 * offset date-time ({@code 2025-09-09T10:15:30+02:00}), date-time with exactly one {@code T}
 * or space separator, optional fraction and optional offset ({@code +00:00}, {@code +0000}),
 * and a plain date. Values without a zone are UTC;
 * plain dates resolve to midnight UTC.
 */
public final class TimestampParser {

    private static final DateTimeFormatter DATE_TIME_T = dateTime('T');
    private static final DateTimeFormatter DATE_TIME_SPACE = dateTime(' ');

    private static final List<Function<String, Instant>> PARSERS =
            List.of(
                    Instant::parse,
                    value -> OffsetDateTime.parse(value).toInstant(),
                    value -> parseDateTime(value, DATE_TIME_T),
                    value -> parseDateTime(value, DATE_TIME_SPACE),
                    value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());

    private TimestampParser() {}

    /**
     * Parses a timestamp string.
     *
     * @param value text to parse
     * @return the parsed instant
     * @throws DateTimeParseException if no accepted form matches
     */
    public static Instant parse(String value) {
        if (value == null) {
            throw new DateTimeParseException("Timestamp is null", "", 0);
        }
        String text = value.trim();
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw last;
    }

    /**
     * @return {@code true} if {@link #parse(String)} would succeed
     */
    public static boolean isParseable(String value) {
        try {
            parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * Date, the given separator, time with optional seconds and fraction, then an optional
     * offset in {@code +HH:MM}, {@code +HHMM} or {@code Z} form.
     */
    private static DateTimeFormatter dateTime(char separator) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .append(DateTimeFormatter.ISO_LOCAL_DATE)
                .appendLiteral(separator)
                .appendValue(ChronoField.HOUR_OF_DAY, 2)
                .appendLiteral(':')
                .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                .optionalStart()
                .appendLiteral(':')
                .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                .optionalEnd()
                .optionalEnd()
                .optionalStart()
                .appendOffset("+HH:MM", "Z")
                .optionalEnd()
                .optionalStart()
                .appendOffset("+HHMM", "Z")
                .optionalEnd()
                .toFormatter();
    }

    private static Instant parseDateTime(String value, DateTimeFormatter formatter) {
        TemporalAccessor parsed = formatter.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }
}
