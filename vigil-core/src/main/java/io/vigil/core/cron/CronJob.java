package io.vigil.core.cron;

import java.util.Objects;

public record CronJob(
    String id,
    String name,
    boolean enabled,
    CronSchedule schedule,
    String payload,
    CronJobState state,
    long createdAt
) {

    public CronJob {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        payload = payload == null ? "" : payload;
        state = state == null ? CronJobState.initial(null) : state;
    }

    public CronJob withName(String value) {
        return new CronJob(id, value, enabled, schedule, payload, state, createdAt);
    }

    public CronJob withEnabled(boolean value) {
        return new CronJob(id, name, value, schedule, payload, state, createdAt);
    }

    public CronJob withSchedule(CronSchedule value) {
        return new CronJob(id, name, enabled, value, payload, state, createdAt);
    }

    public CronJob withPayload(String value) {
        return new CronJob(id, name, enabled, schedule, value, state, createdAt);
    }

    public CronJob withState(CronJobState value) {
        return new CronJob(id, name, enabled, schedule, payload, value, createdAt);
    }
}
