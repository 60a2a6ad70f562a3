package io.vigil.cli;

import io.vigil.core.config.model.VigilConfig;
import io.vigil.core.eventlog.EventLogEntry;
import io.vigil.core.eventlog.EventQuery;
import io.vigil.core.eventlog.FileEventLog;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "events", description = "Print entries from the durable event log")
public final class EventsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--after"}, description = "Only entries with seq greater than this", defaultValue = "0")
    long afterSeq;

    @Option(names = {"--type"}, description = "Only entries of this type")
    String type;

    @Option(names = {"--limit"}, description = "Maximum number of entries", defaultValue = "50")
    int limit;

    @Option(names = {"--workspace"}, description = "Workspace override")
    Path workspace;

    public EventsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            VigilConfig config = context.loadConfig();
            Path logPath = config.scheduler().resolveEventLog(context.workspace(config, workspace));
            if (!Files.exists(logPath)) {
                System.out.println("No events (" + logPath + " does not exist)");
                return 0;
            }
            List<EventLogEntry> entries = FileEventLog.scan(logPath, new EventQuery(afterSeq, limit, type));
            if (entries.isEmpty()) {
                System.out.println("No events");
                return 0;
            }
            for (EventLogEntry entry : entries) {
                System.out.println(entry.seq() + " " + Instant.ofEpochMilli(entry.ts()) + " " + entry.type() + " " + entry.payload());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Events command failed: " + e.getMessage());
            return 1;
        }
    }
}
