package io.vigil.core.cron;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing helpers shared by the schedule variants.
 */
public final class Schedules {
    private static final Pattern DURATION = Pattern.compile("^(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?$");

    private Schedules() {
    }

    /**
     * Parses a compact duration such as {@code 1h30m}, {@code 45s} or {@code 2h}.
     *
     * @return milliseconds, or {@code null} for empty, zero-length or malformed input
     */
    public static Long parseDurationMs(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = DURATION.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        try {
            long hours = group(matcher, 1);
            long minutes = group(matcher, 2);
            long seconds = group(matcher, 3);
            long totalSeconds = Math.addExact(Math.addExact(Math.multiplyExact(hours, 3600L), Math.multiplyExact(minutes, 60L)), seconds);
            long millis = Math.multiplyExact(totalSeconds, 1000L);
            return millis > 0 ? millis : null;
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses an absolute ISO-8601 timestamp. Values without an offset are read in {@code zone}.
     *
     * @return epoch milliseconds, or {@code null} when the text is not a timestamp
     */
    public static Long parseTimestamp(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        Long parsed = attempt(() -> Instant.parse(value).toEpochMilli());
        if (parsed == null) {
            parsed = attempt(() -> OffsetDateTime.parse(value).toInstant().toEpochMilli());
        }
        if (parsed == null) {
            parsed = attempt(() -> ZonedDateTime.parse(value).toInstant().toEpochMilli());
        }
        if (parsed == null) {
            parsed = attempt(() -> LocalDateTime.parse(value).atZone(zone).toInstant().toEpochMilli());
        }
        if (parsed == null) {
            parsed = attempt(() -> LocalDate.parse(value).atStartOfDay(zone).toInstant().toEpochMilli());
        }
        return parsed;
    }

    private static long group(Matcher matcher, int index) {
        String value = matcher.group(index);
        return value == null ? 0 : Long.parseLong(value);
    }

    private static Long attempt(Supplier<Long> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
