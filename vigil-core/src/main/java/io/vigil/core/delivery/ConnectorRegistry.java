package io.vigil.core.delivery;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConnectorRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final Clock clock;
    private final Map<String, Connector> connectors = new LinkedHashMap<>();
    private Interaction lastInteraction;

    public ConnectorRegistry() {
        this(Clock.systemUTC());
    }

    public ConnectorRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized void register(Connector connector) {
        Objects.requireNonNull(connector, "connector must not be null");
        connectors.put(connector.channel(), connector);
        LOG.info("Registered connector {}", connector.channel());
    }

    public synchronized void unregister(String channel) {
        connectors.remove(channel);
    }

    public synchronized List<String> channels() {
        return List.copyOf(connectors.keySet());
    }

    public synchronized void touchInteraction(String channel, String to) {
        Objects.requireNonNull(channel, "channel must not be null");
        lastInteraction = new Interaction(channel, to, clock.instant());
    }

    public synchronized Optional<Interaction> lastInteraction() {
        return Optional.ofNullable(lastInteraction);
    }

    public synchronized Optional<DeliveryTarget> resolveDeliveryTarget() {
        if (lastInteraction != null) {
            Connector connector = connectors.get(lastInteraction.channel());
            if (connector != null) {
                String to = lastInteraction.to() == null ? connector.defaultRecipient() : lastInteraction.to();
                return Optional.of(new DeliveryTarget(connector.channel(), to, connector));
            }
        }
        return connectors.values().stream()
            .findFirst()
            .map(connector -> new DeliveryTarget(connector.channel(), connector.defaultRecipient(), connector));
    }

    public record Interaction(String channel, String to, Instant at) {
    }
}
