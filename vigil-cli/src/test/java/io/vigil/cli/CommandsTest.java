package io.vigil.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.vigil.core.config.ConfigService;
import io.vigil.core.cron.CronEngine;
import io.vigil.core.cron.CronJobCreate;
import io.vigil.core.cron.CronSchedule;
import io.vigil.core.cron.FileCronStore;
import io.vigil.core.eventlog.FileEventLog;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CommandsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path workspace;

    @BeforeEach
    void setUp() throws Exception {
        workspace = tempDir.resolve("workspace");
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": { "workspace": "%s", "provider": "echo" },
              "heartbeat": { "enabled": true, "every": "15m" },
              "scheduler": { "timezone": "UTC" }
            }
            """.formatted(workspace.toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
    }

    @Test
    void statusPrintsHeartbeatAndFileLocations() {
        String out = run(new StatusCommand(context()));

        assertThat(out).contains("Config exists: true");
        assertThat(out).contains("Heartbeat enabled: true");
        assertThat(out).contains("Heartbeat every: 15m");
        assertThat(out).contains("Event log: " + workspace.resolve("data/event-log/events.jsonl") + " (missing)");
    }

    @Test
    void eventsFiltersDurableLogByTypeAndSeq() throws Exception {
        try (FileEventLog log = FileEventLog.open(workspace.resolve("data/event-log/events.jsonl"), 10, CLOCK)) {
            log.append("a", Map.of("n", 1));
            log.append("b", Map.of("n", 2));
            log.append("a", Map.of("n", 3));
            log.append("a", Map.of("n", 4));
        }

        String out = run(new EventsCommand(context()), "--after", "1", "--type", "a", "--limit", "1");

        assertThat(out).contains("3 2025-06-01T10:00:00Z a {\"n\":3}");
        assertThat(out).doesNotContain("{\"n\":4}");
        assertThat(out).doesNotContain("{\"n\":1}");
    }

    @Test
    void eventsReportsMissingLog() {
        assertThat(run(new EventsCommand(context()))).contains("No events");
    }

    @Test
    void jobsPrintsPersistedStore() throws Exception {
        Path storePath = workspace.resolve("data/cron/jobs.json");
        try (FileEventLog log = FileEventLog.open(tempDir.resolve("events.jsonl"), 10, CLOCK);
             CronEngine engine = new CronEngine(log, new FileCronStore(storePath), CLOCK, ZoneOffset.UTC)) {
            engine.add(new CronJobCreate("standup", new CronSchedule.Cron("0 9 * * 1-5"), "standup summary"));
        }

        String out = run(new JobsCommand(context()));

        assertThat(out).contains("standup | cron 0 9 * * 1-5 | enabled | next 2025-06-02T09:00:00Z");
    }

    @Test
    void jobsReportsEmptyStore() {
        assertThat(run(new JobsCommand(context()))).contains("No jobs");
    }

    @Test
    void runDelegatesToDaemonRunner() {
        AtomicReference<Integer> seenPort = new AtomicReference<>();
        AtomicReference<Path> seenWorkspace = new AtomicReference<>();
        CliContext context = new CliContext(new ConfigService(), configPath, (port, ws) -> {
            seenPort.set(port);
            seenWorkspace.set(ws);
            return 0;
        });

        int code = new CommandLine(new RunCommand(context)).execute("--port", "9100", "--workspace", "/tmp/ws");

        assertThat(code).isZero();
        assertThat(seenPort.get()).isEqualTo(9100);
        assertThat(seenWorkspace.get()).isEqualTo(Path.of("/tmp/ws"));
    }

    @Test
    void runFailsWithoutDaemonRunner() {
        int code = new CommandLine(new RunCommand(context())).execute();

        assertThat(code).isEqualTo(1);
    }

    private CliContext context() {
        return new CliContext(new ConfigService(), configPath);
    }

    private static String run(Object command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            assertThat(code).isZero();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
