package io.vigil.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vigil.core.heartbeat.HeartbeatConfig;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VigilConfig(
    AgentConfig agent,
    HeartbeatConfig heartbeat,
    SchedulerConfig scheduler,
    GatewayConfig gateway
) {
    public static final Set<String> SECTIONS = Set.of("agent", "heartbeat", "scheduler", "gateway");

    public static VigilConfig defaults() {
        return new VigilConfig(
            AgentConfig.defaults(),
            HeartbeatConfig.defaults(),
            SchedulerConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
