package io.vigil.core.eventlog;

@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
