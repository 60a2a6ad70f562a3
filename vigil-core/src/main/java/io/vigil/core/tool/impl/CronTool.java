package io.vigil.core.tool.impl;

import io.vigil.core.cron.CronEngine;
import io.vigil.core.cron.CronJob;
import io.vigil.core.cron.CronJobCreate;
import io.vigil.core.cron.CronJobNotFoundException;
import io.vigil.core.cron.CronJobPatch;
import io.vigil.core.cron.CronSchedule;
import io.vigil.core.cron.NaturalTimeParser;
import io.vigil.core.tool.Tool;
import io.vigil.core.tool.ToolContext;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class CronTool implements Tool {
    public static final String SERVICE_KEY = "cronEngine";

    private final NaturalTimeParser timeParser = new NaturalTimeParser();
    private final Clock clock;
    private final ZoneId zone;

    public CronTool() {
        this(Clock.systemUTC(), ZoneId.systemDefault());
    }

    public CronTool(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public String name() {
        return "cron";
    }

    @Override
    public String description() {
        return "Manage scheduled jobs (list, add, update, remove, run_now). A job has exactly one of "
            + "'at' (one-shot; ISO timestamp or phrase like 'in 10m', 'tomorrow at 9am'), "
            + "'every' (interval like '30m', '1h30m') or 'cron' (five-field expression). "
            + "When it fires, 'payload' is sent to you as a prompt.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "action", Map.of("type", "string", "enum", List.of("list", "add", "update", "remove", "run_now")),
                "id", Map.of("type", "string"),
                "name", Map.of("type", "string"),
                "payload", Map.of("type", "string"),
                "at", Map.of("type", "string"),
                "every", Map.of("type", "string"),
                "cron", Map.of("type", "string"),
                "enabled", Map.of("type", "boolean")
            ),
            "required", List.of("action")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String action = text(input, "action");
        CronEngine cronEngine = context.service(SERVICE_KEY, CronEngine.class);
        if (cronEngine == null) {
            return "Error: cron engine is not configured";
        }

        try {
            return switch (action) {
                case "list" -> list(cronEngine);
                case "add" -> add(cronEngine, input);
                case "update" -> update(cronEngine, input);
                case "remove" -> remove(cronEngine, input);
                case "run_now" -> runNow(cronEngine, input);
                default -> "Error: unsupported action: " + action;
            };
        } catch (CronJobNotFoundException | IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        } catch (IOException e) {
            return "Error: failed to persist cron jobs: " + e.getMessage();
        }
    }

    private String list(CronEngine cronEngine) throws IOException {
        List<CronJob> jobs = cronEngine.list();
        if (jobs.isEmpty()) {
            return "No jobs";
        }

        List<String> lines = new ArrayList<>();
        for (CronJob job : jobs) {
            Long next = job.state().nextRunAtMs();
            lines.add(job.id()
                + " | " + job.name()
                + " | " + describe(job.schedule())
                + " | " + (job.enabled() ? "enabled" : "disabled")
                + " | next " + (next == null ? "-" : Instant.ofEpochMilli(next).toString()));
        }
        return String.join("\n", lines);
    }

    private String add(CronEngine cronEngine, Map<String, Object> input) throws IOException {
        String name = text(input, "name");
        String payload = text(input, "payload");
        if (name.isBlank() || payload.isBlank()) {
            return "Error: name and payload are required";
        }
        CronSchedule schedule = schedule(input);
        if (schedule == null) {
            return "Error: one of at, every or cron is required";
        }
        String id = cronEngine.add(new CronJobCreate(name, schedule, payload, !Boolean.FALSE.equals(input.get("enabled"))));
        CronJob job = cronEngine.get(id).orElseThrow();
        if (job.state().nextRunAtMs() == null) {
            return "Created cron job " + id + " (warning: schedule never fires: " + describe(schedule) + ")";
        }
        return "Created cron job " + id + ", next run " + Instant.ofEpochMilli(job.state().nextRunAtMs());
    }

    private String update(CronEngine cronEngine, Map<String, Object> input) throws IOException {
        String id = text(input, "id");
        if (id.isBlank()) {
            return "Error: id is required";
        }
        Object enabled = input.get("enabled");
        CronJobPatch patch = new CronJobPatch(
            blankToNull(text(input, "name")),
            schedule(input),
            input.containsKey("payload") ? text(input, "payload") : null,
            enabled == null ? null : Boolean.valueOf(String.valueOf(enabled))
        );
        CronJob job = cronEngine.update(id, patch);
        return "Updated " + job.id() + ": " + describe(job.schedule()) + (job.enabled() ? "" : " (disabled)");
    }

    private String remove(CronEngine cronEngine, Map<String, Object> input) throws IOException {
        String id = text(input, "id");
        if (id.isBlank()) {
            return "Error: id is required";
        }
        cronEngine.remove(id);
        return "Removed: " + id;
    }

    private String runNow(CronEngine cronEngine, Map<String, Object> input) throws IOException {
        String id = text(input, "id");
        if (id.isBlank()) {
            return "Error: id is required";
        }
        CronJob job = cronEngine.runNow(id);
        return "Fired " + job.id() + " (" + job.name() + ")";
    }

    private CronSchedule schedule(Map<String, Object> input) {
        String at = text(input, "at");
        if (!at.isBlank()) {
            return new CronSchedule.At(timeParser.resolve(at, clock, zone).toString());
        }
        String every = text(input, "every");
        if (!every.isBlank()) {
            return new CronSchedule.Every(every);
        }
        String cron = text(input, "cron");
        if (!cron.isBlank()) {
            return new CronSchedule.Cron(cron);
        }
        return null;
    }

    public static String describe(CronSchedule schedule) {
        if (schedule instanceof CronSchedule.At at) {
            return "once at " + at.at();
        }
        if (schedule instanceof CronSchedule.Every every) {
            return "every " + every.every();
        }
        return "cron " + ((CronSchedule.Cron) schedule).cron();
    }

    private static String text(Map<String, Object> input, String key) {
        Object value = input.get(key);
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static String blankToNull(String value) {
        return value.isBlank() ? null : value;
    }
}
