package io.vigil.core.cron;

public record CronJobState(Long nextRunAtMs, Long lastRunAtMs, JobStatus lastStatus, int consecutiveErrors) {

    public CronJobState {
        consecutiveErrors = Math.max(0, consecutiveErrors);
    }

    public static CronJobState initial(Long nextRunAtMs) {
        return new CronJobState(nextRunAtMs, null, null, 0);
    }

    public CronJobState withNextRunAtMs(Long next) {
        return new CronJobState(next, lastRunAtMs, lastStatus, consecutiveErrors);
    }

    public CronJobState withConsecutiveErrors(int errors) {
        return new CronJobState(nextRunAtMs, lastRunAtMs, lastStatus, errors);
    }

    public CronJobState succeeded(long runAtMs) {
        return new CronJobState(nextRunAtMs, runAtMs, JobStatus.OK, 0);
    }

    public CronJobState failed(long runAtMs) {
        return new CronJobState(nextRunAtMs, runAtMs, JobStatus.ERROR, consecutiveErrors + 1);
    }
}
