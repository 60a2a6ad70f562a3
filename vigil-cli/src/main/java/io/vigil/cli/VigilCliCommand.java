package io.vigil.cli;

import picocli.CommandLine.Command;

@Command(name = "vigil", mixinStandardHelpOptions = true, description = "Vigil event log, cron scheduler and heartbeat")
public final class VigilCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
