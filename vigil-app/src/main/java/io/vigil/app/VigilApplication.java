package io.vigil.app;

import io.vigil.cli.CliContext;
import io.vigil.cli.EventsCommand;
import io.vigil.cli.JobsCommand;
import io.vigil.cli.RunCommand;
import io.vigil.cli.StatusCommand;
import io.vigil.cli.VigilCliCommand;
import io.vigil.core.api.GatewayServer;
import io.vigil.core.config.ConfigPaths;
import io.vigil.core.config.ConfigService;
import io.vigil.core.config.model.AgentConfig;
import io.vigil.core.config.model.SchedulerConfig;
import io.vigil.core.config.model.VigilConfig;
import io.vigil.core.cron.CronEngine;
import io.vigil.core.cron.CronListener;
import io.vigil.core.cron.FileCronStore;
import io.vigil.core.delivery.ConnectorRegistry;
import io.vigil.core.engine.LlmConversationEngine;
import io.vigil.core.eventlog.FileEventLog;
import io.vigil.core.heartbeat.Heartbeat;
import io.vigil.core.provider.ChatCompletionsProvider;
import io.vigil.core.provider.DisabledProvider;
import io.vigil.core.provider.EchoProvider;
import io.vigil.core.provider.LlmProvider;
import io.vigil.core.session.FileSessionStore;
import io.vigil.core.tool.ToolRegistry;
import io.vigil.core.tool.impl.CronTool;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class VigilApplication {
    private static final Logger LOG = LoggerFactory.getLogger(VigilApplication.class);

    private VigilApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            (port, workspaceOverride) -> runDaemon(configService, configPath, port, workspaceOverride)
        );

        CommandLine commandLine = new CommandLine(new VigilCliCommand());
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("events", new EventsCommand(context));
        commandLine.addSubcommand("jobs", new JobsCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runDaemon(
        ConfigService configService,
        Path configPath,
        Integer portOverride,
        Path workspaceOverride
    ) throws Exception {
        VigilConfig config = configService.load(configPath);
        AgentConfig agent = config.agent();
        SchedulerConfig scheduler = config.scheduler();
        Path workspace = workspaceOverride != null
            ? workspaceOverride.toAbsolutePath().normalize()
            : ConfigPaths.resolveWorkspace(agent.workspace());
        ZoneId zone = scheduler.resolveZone();
        Clock clock = Clock.system(zone);
        int port = portOverride != null ? portOverride : config.gateway().port();

        FileEventLog eventLog = FileEventLog.open(scheduler.resolveEventLog(workspace), scheduler.eventBufferSize(), clock);
        CronEngine cronEngine = new CronEngine(eventLog, new FileCronStore(scheduler.resolveJobStore(workspace)), clock, zone);

        ToolRegistry toolRegistry = new ToolRegistry();
        toolRegistry.register(new CronTool(clock, zone));
        LlmConversationEngine engine = new LlmConversationEngine(
            buildProvider(agent),
            agent.model(),
            agent.systemPrompt(),
            toolRegistry,
            Map.of(CronTool.SERVICE_KEY, cronEngine),
            workspace,
            agent.maxToolIterations(),
            agent.historyTurns(),
            clock
        );

        Path sessions = scheduler.resolveSessions(workspace);
        ConnectorRegistry connectors = new ConnectorRegistry(clock);
        CronListener cronListener = new CronListener(
            eventLog,
            engine,
            new FileSessionStore(sessions, "cron/default"),
            connectors,
            Set.of(Heartbeat.JOB_NAME),
            clock
        );
        Heartbeat heartbeat = new Heartbeat(
            config.heartbeat(),
            cronEngine,
            eventLog,
            engine,
            new FileSessionStore(sessions, "heartbeat"),
            connectors,
            configService.writerFor(configPath),
            clock
        );
        GatewayServer gateway = new GatewayServer(
            config.gateway().host(),
            port,
            eventLog,
            cronEngine,
            heartbeat,
            engine,
            new FileSessionStore(sessions, "web"),
            connectors
        );

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "vigil-shutdown"));
        try {
            cronEngine.start();
            cronListener.start();
            heartbeat.start();
            gateway.start();
            System.out.println("Vigil running on http://" + config.gateway().host() + ":" + gateway.port());
            System.out.println("Workspace: " + workspace);
            System.out.println("Endpoints: GET /healthz, /api/events, /api/cron/jobs, /api/heartbeat/status, POST /api/chat, WS /ws");
            shutdown.await();
        } finally {
            LOG.info("Shutting down");
            gateway.close();
            heartbeat.close();
            cronListener.close();
            cronEngine.close();
            eventLog.close();
        }
        return 0;
    }

    private static LlmProvider buildProvider(AgentConfig agent) {
        String name = agent.provider() == null ? "" : agent.provider().trim();
        if ("echo".equalsIgnoreCase(name)) {
            return new EchoProvider(name);
        }
        if (!agent.configured()) {
            return new DisabledProvider(name, "missing API key");
        }
        return new ChatCompletionsProvider(name, agent.apiKey(), agent.apiBase());
    }
}
