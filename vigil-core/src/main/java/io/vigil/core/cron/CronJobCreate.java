package io.vigil.core.cron;

import java.util.Objects;

public record CronJobCreate(String name, CronSchedule schedule, String payload, boolean enabled) {

    public CronJobCreate {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        payload = payload == null ? "" : payload;
    }

    public CronJobCreate(String name, CronSchedule schedule, String payload) {
        this(name, schedule, payload, true);
    }
}
