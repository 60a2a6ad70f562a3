package io.vigil.cli;

import io.vigil.core.config.ConfigPaths;
import io.vigil.core.config.ConfigService;
import io.vigil.core.config.model.VigilConfig;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    DaemonRunner daemonRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (port, workspace) -> {
            throw new UnsupportedOperationException("daemon runner is not configured");
        });
    }

    public VigilConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public Path workspace(VigilConfig config, Path override) {
        return override != null
            ? override.toAbsolutePath().normalize()
            : ConfigPaths.resolveWorkspace(config.agent().workspace());
    }
}
