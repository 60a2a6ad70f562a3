package io.vigil.core.heartbeat;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ActiveHoursTest {

    @Test
    void shouldUseHalfOpenDaytimeWindow() {
        ActiveHours hours = new ActiveHours("09:00", "17:00", "UTC");

        assertThat(hours.contains(Instant.parse("2025-06-01T09:00:00Z"), ZoneOffset.UTC)).isTrue();
        assertThat(hours.contains(Instant.parse("2025-06-01T16:59:00Z"), ZoneOffset.UTC)).isTrue();
        assertThat(hours.contains(Instant.parse("2025-06-01T17:00:00Z"), ZoneOffset.UTC)).isFalse();
        assertThat(hours.contains(Instant.parse("2025-06-01T08:59:00Z"), ZoneOffset.UTC)).isFalse();
    }

    @Test
    void shouldWrapPastMidnight() {
        ActiveHours night = new ActiveHours("22:00", "06:00", "UTC");

        assertThat(night.contains(Instant.parse("2025-06-01T23:30:00Z"), ZoneOffset.UTC)).isTrue();
        assertThat(night.contains(Instant.parse("2025-06-01T05:59:00Z"), ZoneOffset.UTC)).isTrue();
        assertThat(night.contains(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC)).isFalse();
    }

    @Test
    void shouldEvaluateInConfiguredOrHostZone() {
        Instant sevenUtc = Instant.parse("2025-06-01T07:00:00Z");

        assertThat(new ActiveHours("09:00", "17:00", "Europe/Berlin").contains(sevenUtc, ZoneOffset.UTC)).isTrue();
        assertThat(new ActiveHours("09:00", "17:00", "local").contains(sevenUtc, ZoneId.of("Europe/Berlin"))).isTrue();
        assertThat(new ActiveHours("09:00", "17:00", null).contains(sevenUtc, ZoneOffset.UTC)).isFalse();
        assertThat(new ActiveHours("09:00", "17:00", "Mars/Olympus").contains(sevenUtc, ZoneOffset.UTC)).isFalse();
    }

    @Test
    void malformedBoundsShouldNotRestrict() {
        Instant midnight = Instant.parse("2025-06-01T00:00:00Z");

        assertThat(new ActiveHours("9am", "17:00", "UTC").contains(midnight, ZoneOffset.UTC)).isTrue();
        assertThat(new ActiveHours("09:00", "25:00", "UTC").contains(midnight, ZoneOffset.UTC)).isTrue();
        assertThat(new ActiveHours(null, null, "UTC").contains(midnight, ZoneOffset.UTC)).isTrue();
    }

    @Test
    void dedupShouldSuppressSameTextWithinWindow() {
        HeartbeatDedup dedup = new HeartbeatDedup(1_000L);
        dedup.record("hello", 10_000L);

        assertThat(dedup.isDuplicate("hello", 10_500L)).isTrue();
        assertThat(dedup.isDuplicate("hello", 11_000L)).isFalse();
        assertThat(dedup.isDuplicate("other", 10_500L)).isFalse();
        assertThat(new HeartbeatDedup().isDuplicate("hello", 0L)).isFalse();
    }
}
