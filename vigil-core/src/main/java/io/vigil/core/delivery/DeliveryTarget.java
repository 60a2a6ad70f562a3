package io.vigil.core.delivery;

import java.io.IOException;
import java.util.Objects;

public record DeliveryTarget(String channel, String to, Connector connector) {

    public DeliveryTarget {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(connector, "connector must not be null");
    }

    public void deliver(String text) throws IOException {
        connector.send(to, text);
    }
}
