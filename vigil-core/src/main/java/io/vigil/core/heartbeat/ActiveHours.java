package io.vigil.core.heartbeat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ActiveHours(String start, String end, String timezone) {
    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    public ActiveHours {
        timezone = timezone == null || timezone.isBlank() ? "local" : timezone;
    }

    public boolean contains(Instant now, ZoneId hostZone) {
        Integer startMinutes = minutesOfDay(start);
        Integer endMinutes = minutesOfDay(end);
        if (startMinutes == null || endMinutes == null) {
            return true;
        }
        LocalTime local = now.atZone(resolveZone(hostZone)).toLocalTime();
        int nowMinutes = local.getHour() * 60 + local.getMinute();
        if (startMinutes <= endMinutes) {
            return nowMinutes >= startMinutes && nowMinutes < endMinutes;
        }
        return nowMinutes >= startMinutes || nowMinutes < endMinutes;
    }

    ZoneId resolveZone(ZoneId hostZone) {
        if ("local".equalsIgnoreCase(timezone)) {
            return hostZone;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return hostZone;
        }
    }

    static Integer minutesOfDay(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = HH_MM.matcher(value.trim());
        if (!matcher.matches()) {
            return null;
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        if (hours > 23 || minutes > 59) {
            return null;
        }
        return hours * 60 + minutes;
    }
}
