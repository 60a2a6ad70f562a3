package io.vigil.cli;

import io.vigil.core.config.model.VigilConfig;
import io.vigil.core.cron.CronJob;
import io.vigil.core.cron.FileCronStore;
import io.vigil.core.tool.impl.CronTool;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "jobs", description = "Print the persisted cron jobs")
public final class JobsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--workspace"}, description = "Workspace override")
    Path workspace;

    public JobsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            VigilConfig config = context.loadConfig();
            FileCronStore store = new FileCronStore(config.scheduler().resolveJobStore(context.workspace(config, workspace)));
            List<CronJob> jobs = store.load();
            if (jobs.isEmpty()) {
                System.out.println("No jobs");
                return 0;
            }
            for (CronJob job : jobs) {
                System.out.println(String.join(" | ",
                    job.id(),
                    job.name(),
                    CronTool.describe(job.schedule()),
                    job.enabled() ? "enabled" : "disabled",
                    "next " + format(job.state().nextRunAtMs()),
                    "last " + format(job.state().lastRunAtMs()) + statusSuffix(job)
                ));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Jobs command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String format(Long epochMs) {
        return epochMs == null ? "-" : Instant.ofEpochMilli(epochMs).toString();
    }

    private static String statusSuffix(CronJob job) {
        if (job.state().lastStatus() == null) {
            return "";
        }
        String suffix = " (" + job.state().lastStatus().name().toLowerCase();
        if (job.state().consecutiveErrors() > 0) {
            suffix += ", " + job.state().consecutiveErrors() + " consecutive errors";
        }
        return suffix + ")";
    }
}
