package io.vigil.core.cron;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Optional;

/**
 * Standard five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Fields accept {@code *}, single values, ranges {@code a-b}, steps {@code *}/s and
 * {@code a-b/s}, and comma separated lists of those. Day-of-week runs 0-6 from Sunday; 7 is
 * also Sunday. All five fields must match, including day-of-month and day-of-week together.
 */
public final class CronExpression {
    static final int SEARCH_DAYS = 366;

    private final String source;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;

    private CronExpression(String source, BitSet minutes, BitSet hours, BitSet daysOfMonth, BitSet months, BitSet daysOfWeek) {
        this.source = source;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
    }

    /**
     * @return the parsed expression, or empty when it is malformed
     */
    public static Optional<CronExpression> parse(String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            return Optional.empty();
        }
        try {
            BitSet daysOfWeek = parseField(fields[4], 0, 7);
            if (daysOfWeek.get(7)) {
                daysOfWeek.clear(7);
                daysOfWeek.set(0);
            }
            return Optional.of(new CronExpression(
                expression.trim(),
                parseField(fields[0], 0, 59),
                parseField(fields[1], 0, 23),
                parseField(fields[2], 1, 31),
                parseField(fields[3], 1, 12),
                daysOfWeek
            ));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * First whole minute strictly after {@code afterMs} whose wall-clock time in {@code zone}
     * matches every field, searched up to a year ahead.
     *
     * @return epoch milliseconds, or {@code null} when nothing matches in the window
     */
    public Long nextFireAfter(long afterMs, ZoneId zone) {
        ZonedDateTime candidate = Instant.ofEpochMilli(afterMs).atZone(zone)
            .truncatedTo(ChronoUnit.MINUTES)
            .plusMinutes(1);
        ZonedDateTime limit = candidate.plusDays(SEARCH_DAYS);

        while (candidate.isBefore(limit)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.plusMonths(1).withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
                continue;
            }
            if (!daysOfMonth.get(candidate.getDayOfMonth())
                || !daysOfWeek.get(candidate.getDayOfWeek().getValue() % 7)) {
                candidate = candidate.plusDays(1).truncatedTo(ChronoUnit.DAYS);
                continue;
            }
            if (!hours.get(candidate.getHour())) {
                candidate = candidate.plusHours(1).truncatedTo(ChronoUnit.HOURS);
                continue;
            }
            if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return candidate.toInstant().toEpochMilli();
        }
        return null;
    }

    @Override
    public String toString() {
        return source;
    }

    private static BitSet parseField(String field, int min, int max) {
        BitSet values = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            parsePart(part, min, max, values);
        }
        return values;
    }

    private static void parsePart(String part, int min, int max, BitSet values) {
        if (part.isEmpty()) {
            throw new IllegalArgumentException("empty cron field part");
        }
        String range = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = number(part.substring(slash + 1));
            if (step <= 0) {
                throw new IllegalArgumentException("cron step must be > 0: " + part);
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = min;
            to = max;
        } else if (range.contains("-")) {
            int dash = range.indexOf('-');
            from = number(range.substring(0, dash));
            to = number(range.substring(dash + 1));
        } else {
            from = number(range);
            to = slash >= 0 ? max : from;
        }
        if (from < min || to > max || from > to) {
            throw new IllegalArgumentException("cron value out of range: " + part);
        }
        for (int value = from; value <= to; value += step) {
            values.set(value);
        }
    }

    private static int number(String text) {
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("not a number: " + text);
        }
        return Integer.parseInt(text);
    }
}
