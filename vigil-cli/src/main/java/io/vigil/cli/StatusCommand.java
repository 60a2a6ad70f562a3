package io.vigil.cli;

import io.vigil.core.config.model.VigilConfig;
import io.vigil.core.heartbeat.HeartbeatConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration, heartbeat and storage status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            VigilConfig config = context.loadConfig();
            Path workspace = context.workspace(config, null);
            HeartbeatConfig heartbeat = config.heartbeat();
            Path eventLog = config.scheduler().resolveEventLog(workspace);
            Path jobStore = config.scheduler().resolveJobStore(workspace);
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + workspace);
            System.out.println("Provider: " + config.agent().provider() + " (configured: " + config.agent().configured() + ")");
            System.out.println("Model: " + config.agent().model());
            System.out.println("Heartbeat enabled: " + heartbeat.enabled());
            System.out.println("Heartbeat every: " + heartbeat.every());
            System.out.println("Heartbeat active hours: " + (heartbeat.activeHours() == null ? "always" : heartbeat.activeHours()));
            System.out.println("Event log: " + eventLog + (Files.exists(eventLog) ? "" : " (missing)"));
            System.out.println("Job store: " + jobStore + (Files.exists(jobStore) ? "" : " (missing)"));
            System.out.println("Sessions: " + config.scheduler().resolveSessions(workspace));
            System.out.println("Timezone: " + config.scheduler().resolveZone());
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
