package io.vigil.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileSessionStore implements SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileSessionStore.class);
    private static final Pattern VALID_ID = Pattern.compile("^[A-Za-z0-9_-]+(/[A-Za-z0-9_-]+)*$");

    private final String id;
    private final Path path;
    private final ObjectMapper mapper;

    public FileSessionStore(Path root, String id) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(id, "id must not be null");
        if (!VALID_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("invalid session id: " + id);
        }
        this.id = id;
        this.path = root.resolve(id + ".jsonl");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String id() {
        return id;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void append(ConversationTurn turn) throws IOException {
        Objects.requireNonNull(turn, "turn must not be null");
        Files.createDirectories(path.toAbsolutePath().getParent());
        Files.writeString(
            path,
            mapper.writeValueAsString(turn) + "\n",
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
    }

    @Override
    public synchronized List<ConversationTurn> list() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<ConversationTurn> turns = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    turns.add(mapper.readValue(line, ConversationTurn.class));
                } catch (JsonProcessingException e) {
                    LOG.debug("Skipping malformed line in session {}", id, e);
                }
            }
        }
        return List.copyOf(turns);
    }
}
