package io.vigil.core.eventlog;

@FunctionalInterface
public interface EventListener {
    void onEvent(EventLogEntry entry);
}
