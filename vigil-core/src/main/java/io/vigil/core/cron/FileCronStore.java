package io.vigil.core.cron;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

public final class FileCronStore implements CronStore {
    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileCronStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized List<CronJob> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return List.of();
        }
        return mapper.readValue(json, JobsDocument.class).jobs();
    }

    @Override
    public synchronized void save(List<CronJob> jobs) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(new JobsDocument(jobs));
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    record JobsDocument(List<CronJob> jobs) {
        JobsDocument {
            jobs = jobs == null ? List.of() : List.copyOf(jobs);
        }
    }
}
