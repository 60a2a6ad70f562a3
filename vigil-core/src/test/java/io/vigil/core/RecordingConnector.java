package io.vigil.core;

import io.vigil.core.delivery.Connector;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connector that keeps every message it is asked to send, formatted as {@code to: text}.
 */
public final class RecordingConnector implements Connector {
    private final String channel;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingConnector(String channel) {
        this.channel = channel;
    }

    public List<String> sent() {
        return sent;
    }

    public void failing(boolean value) {
        failing = value;
    }

    @Override
    public String channel() {
        return channel;
    }

    @Override
    public void send(String to, String text) throws IOException {
        if (failing) {
            throw new IOException(channel + " is down");
        }
        sent.add(to + ": " + text);
    }
}
