package io.vigil.core.eventlog;

import java.io.IOException;
import java.util.List;

/**
 * Durable, append-only log of typed events with in-process fan-out.
 *
 * <p>Global subscribers are notified before type subscribers, each group in registration order.
 * A subscriber that throws does not affect the append or the other subscribers.
 */
public interface EventLog extends AutoCloseable {

    /**
     * Appends an entry with the next sequence number. The line is written to durable storage
     * before any subscriber is notified; on a write failure the entry is not committed.
     */
    EventLogEntry append(String type, Object payload) throws IOException;

    /** Reads matching entries from durable storage, skipping malformed lines. */
    List<EventLogEntry> read(EventQuery query) throws IOException;

    /** Reads matching entries from the in-memory tail only. */
    List<EventLogEntry> recent(EventQuery query);

    long lastSeq();

    Subscription subscribe(EventListener listener);

    Subscription subscribeType(String type, EventListener listener);

    /** Drops subscribers and the in-memory tail; durable storage is left untouched. */
    @Override
    void close();
}
