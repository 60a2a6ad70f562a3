package io.vigil.core.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLog} backed by a JSON Lines file. Every append is written to the file before it
 * is buffered or dispatched, and the sequence counter is restored from the file on open.
 */
public final class FileEventLog implements EventLog {
    public static final int DEFAULT_BUFFER_SIZE = 500;

    private static final Logger LOG = LoggerFactory.getLogger(FileEventLog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path path;
    private final int bufferSize;
    private final Clock clock;
    private final Deque<EventLogEntry> buffer = new ArrayDeque<>();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, List<EventListener>> typeListeners = new ConcurrentHashMap<>();
    private long seq;

    private FileEventLog(Path path, int bufferSize, Clock clock) {
        this.path = path;
        this.bufferSize = bufferSize;
        this.clock = clock;
    }

    public static FileEventLog open(Path path) throws IOException {
        return open(path, DEFAULT_BUFFER_SIZE, Clock.systemUTC());
    }

    public static FileEventLog open(Path path, int bufferSize, Clock clock) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0");
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileEventLog log = new FileEventLog(path, bufferSize, clock);
        log.recover();
        return log;
    }

    /**
     * Scans a log file without opening it for writing. A missing file reads as empty.
     */
    public static List<EventLogEntry> scan(Path path, EventQuery query) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<EventLogEntry> results = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                EventLogEntry entry = parseLine(line);
                if (entry == null || !query.matches(entry)) {
                    continue;
                }
                results.add(entry);
                if (results.size() >= query.limit()) {
                    break;
                }
            }
        }
        return results;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized EventLogEntry append(String type, Object payload) throws IOException {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        EventLogEntry entry = new EventLogEntry(seq + 1, clock.millis(), type, MAPPER.valueToTree(payload));
        String line = MAPPER.writeValueAsString(entry) + "\n";
        Files.writeString(path, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);

        seq = entry.seq();
        buffer.addLast(entry);
        while (buffer.size() > bufferSize) {
            buffer.removeFirst();
        }
        dispatch(entry);
        return entry;
    }

    @Override
    public synchronized List<EventLogEntry> read(EventQuery query) throws IOException {
        return scan(path, Objects.requireNonNull(query, "query must not be null"));
    }

    @Override
    public synchronized List<EventLogEntry> recent(EventQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        List<EventLogEntry> results = new ArrayList<>();
        for (EventLogEntry entry : buffer) {
            if (!query.matches(entry)) {
                continue;
            }
            results.add(entry);
            if (results.size() >= query.limit()) {
                break;
            }
        }
        return results;
    }

    @Override
    public synchronized long lastSeq() {
        return seq;
    }

    @Override
    public Subscription subscribe(EventListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public Subscription subscribeType(String type, EventListener listener) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        typeListeners.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> {
            List<EventListener> registered = typeListeners.get(type);
            if (registered != null) {
                registered.remove(listener);
            }
        };
    }

    @Override
    public synchronized void close() {
        listeners.clear();
        typeListeners.clear();
        buffer.clear();
    }

    private void recover() throws IOException {
        truncateTornTail();
        List<EventLogEntry> entries = scan(path, EventQuery.all());
        if (entries.isEmpty()) {
            return;
        }
        seq = entries.get(entries.size() - 1).seq();
        int from = Math.max(0, entries.size() - bufferSize);
        buffer.addAll(entries.subList(from, entries.size()));
        LOG.debug("Recovered {} events from {} (last seq {})", entries.size(), path, seq);
    }

    /**
     * Drops a final line without its newline, left behind by a write that never completed, so the
     * next append starts on a fresh line.
     */
    private void truncateTornTail() throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            if (size == 0 || byteAt(channel, size - 1) == '\n') {
                return;
            }
            long keep = size - 1;
            while (keep > 0 && byteAt(channel, keep - 1) != '\n') {
                keep--;
            }
            channel.truncate(keep);
            channel.force(true);
            LOG.warn("Truncated {} bytes of incomplete event at the end of {}", size - keep, path);
        }
    }

    private static byte byteAt(FileChannel channel, long position) throws IOException {
        ByteBuffer single = ByteBuffer.allocate(1);
        if (channel.read(single, position) != 1) {
            throw new IOException("Unable to read event log at offset " + position);
        }
        return single.get(0);
    }

    private void dispatch(EventLogEntry entry) {
        for (EventListener listener : listeners) {
            notifyQuietly(listener, entry);
        }
        List<EventListener> registered = typeListeners.get(entry.type());
        if (registered != null) {
            for (EventListener listener : registered) {
                notifyQuietly(listener, entry);
            }
        }
    }

    private void notifyQuietly(EventListener listener, EventLogEntry entry) {
        try {
            listener.onEvent(entry);
        } catch (RuntimeException e) {
            LOG.debug("Event listener failed for {} #{}", entry.type(), entry.seq(), e);
        }
    }

    private static EventLogEntry parseLine(String line) {
        if (line.isBlank()) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(line);
            if (node == null || !node.isObject() || !node.path("seq").canConvertToLong()
                || !node.path("type").isTextual()) {
                return null;
            }
            long entrySeq = node.path("seq").asLong();
            if (entrySeq <= 0) {
                return null;
            }
            return new EventLogEntry(entrySeq, node.path("ts").asLong(), node.path("type").asText(), node.get("payload"));
        } catch (JsonProcessingException e) {
            LOG.debug("Skipping malformed event log line", e);
            return null;
        }
    }
}
