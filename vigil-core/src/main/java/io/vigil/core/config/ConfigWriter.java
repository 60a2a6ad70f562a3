package io.vigil.core.config;

import java.io.IOException;

@FunctionalInterface
public interface ConfigWriter {
    void writeConfigSection(String section, Object data) throws IOException;
}
