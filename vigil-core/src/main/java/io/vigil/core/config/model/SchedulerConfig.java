package io.vigil.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"event_log"}) String eventLog,
    @JsonAlias({"job_store"}) String jobStore,
    String sessions,
    @JsonAlias({"event_buffer_size"}) int eventBufferSize,
    String timezone
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("data/event-log/events.jsonl", "data/cron/jobs.json", "data/sessions", 500, "local");
    }

    public Path resolveEventLog(Path workspace) {
        return workspace.resolve(eventLog);
    }

    public Path resolveJobStore(Path workspace) {
        return workspace.resolve(jobStore);
    }

    public Path resolveSessions(Path workspace) {
        return workspace.resolve(sessions);
    }

    public ZoneId resolveZone() {
        if (timezone == null || timezone.isBlank() || "local".equalsIgnoreCase(timezone)) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid scheduler timezone: " + timezone, e);
        }
    }
}
