package io.vigil.cli;

import java.nio.file.Path;

/**
 * Starts the long-running scheduler process and blocks until it is shut down.
 * A {@code null} port or workspace means "use the configured value".
 */
@FunctionalInterface
public interface DaemonRunner {
    int run(Integer port, Path workspaceOverride) throws Exception;
}
