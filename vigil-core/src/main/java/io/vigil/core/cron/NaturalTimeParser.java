package io.vigil.core.cron;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class NaturalTimeParser {
    private static final Pattern IN_PATTERN = Pattern.compile("^in\\s+(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days)$");
    private static final Pattern DAY_AT_PATTERN = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final Pattern MERIDIEM = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(am|pm)$");
    private static final Pattern TWENTY_FOUR = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public Instant resolve(String expression, Clock clock, ZoneId zoneId) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("time expression is required");
        }

        String normalized = expression.trim().toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        Matcher inMatcher = IN_PATTERN.matcher(normalized);
        if (inMatcher.matches()) {
            long value = Long.parseLong(inMatcher.group(1));
            long seconds = switch (inMatcher.group(2).charAt(0)) {
                case 's' -> value;
                case 'm' -> value * 60;
                case 'h' -> value * 3600;
                default -> value * 86400;
            };
            return now.plusSeconds(seconds);
        }

        Matcher dayMatcher = DAY_AT_PATTERN.matcher(normalized);
        if (dayMatcher.matches()) {
            LocalDate baseDate = LocalDateTime.ofInstant(now, zoneId).toLocalDate();
            if ("tomorrow".equals(dayMatcher.group(1))) {
                baseDate = baseDate.plusDays(1);
            }
            return LocalDateTime.of(baseDate, parseTime(dayMatcher.group(2))).atZone(zoneId).toInstant();
        }

        Long timestamp = Schedules.parseTimestamp(expression, zoneId);
        if (timestamp != null) {
            return Instant.ofEpochMilli(timestamp);
        }
        try {
            return LocalDateTime.parse(expression.trim(), DATE_TIME_SPACE).atZone(zoneId).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unable to parse time expression: " + expression, e);
        }
    }

    private LocalTime parseTime(String token) {
        if (token == null || token.isBlank()) {
            return LocalTime.of(9, 0);
        }

        String value = token.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        Matcher meridiem = MERIDIEM.matcher(value);
        if (meridiem.matches()) {
            int hour = Integer.parseInt(meridiem.group(1)) % 12;
            int minute = meridiem.group(2) == null ? 0 : Integer.parseInt(meridiem.group(2));
            if ("pm".equals(meridiem.group(3))) {
                hour += 12;
            }
            return LocalTime.of(hour, minute);
        }

        Matcher twentyFour = TWENTY_FOUR.matcher(value);
        if (twentyFour.matches()) {
            int hour = Integer.parseInt(twentyFour.group(1));
            int minute = twentyFour.group(2) == null ? 0 : Integer.parseInt(twentyFour.group(2));
            return LocalTime.of(hour, minute);
        }

        throw new IllegalArgumentException("invalid time format: " + token);
    }
}
