package io.vigil.core.cron;

public record CronJobPatch(String name, CronSchedule schedule, String payload, Boolean enabled) {

    public CronJobPatch {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static CronJobPatch empty() {
        return new CronJobPatch(null, null, null, null);
    }

    public static CronJobPatch enabled(boolean enabled) {
        return new CronJobPatch(null, null, null, enabled);
    }

    public CronJobPatch withName(String value) {
        return new CronJobPatch(value, schedule, payload, enabled);
    }

    public CronJobPatch withSchedule(CronSchedule value) {
        return new CronJobPatch(name, value, payload, enabled);
    }

    public CronJobPatch withPayload(String value) {
        return new CronJobPatch(name, schedule, value, enabled);
    }

    public CronJobPatch withEnabled(Boolean value) {
        return new CronJobPatch(name, schedule, payload, value);
    }
}
