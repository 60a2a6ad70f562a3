package io.vigil.core.cron;

public final class CronJobNotFoundException extends RuntimeException {
    private final String jobId;

    public CronJobNotFoundException(String jobId) {
        super("cron job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
