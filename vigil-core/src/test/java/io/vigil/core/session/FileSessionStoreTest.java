package io.vigil.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSessionStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendAndReadTurnsInOrder() throws Exception {
        FileSessionStore store = new FileSessionStore(tempDir, "cron/default");

        store.append(new ConversationTurn(Instant.parse("2025-06-01T10:00:00Z"), "q1", "a1"));
        store.append(new ConversationTurn(Instant.parse("2025-06-01T10:05:00Z"), "q2", "a2"));
        store.append(new ConversationTurn(Instant.parse("2025-06-01T10:10:00Z"), "q3", "a3"));

        assertThat(store.path()).isEqualTo(tempDir.resolve("cron/default.jsonl"));
        assertThat(store.list()).extracting(ConversationTurn::prompt).containsExactly("q1", "q2", "q3");
        assertThat(store.recent(2)).extracting(ConversationTurn::response).containsExactly("a2", "a3");
        assertThat(store.recent(0)).isEmpty();

        FileSessionStore reopened = new FileSessionStore(tempDir, "cron/default");
        assertThat(reopened.list().get(0).createdAt()).isEqualTo(Instant.parse("2025-06-01T10:00:00Z"));
    }

    @Test
    void shouldKeepSessionsSeparate() throws Exception {
        new FileSessionStore(tempDir, "heartbeat").append(new ConversationTurn(Instant.EPOCH, "hb", "ok"));

        assertThat(new FileSessionStore(tempDir, "web").list()).isEmpty();
    }

    @Test
    void shouldSkipMalformedLines() throws Exception {
        FileSessionStore store = new FileSessionStore(tempDir, "web");
        store.append(new ConversationTurn(Instant.EPOCH, "q1", "a1"));
        Files.writeString(store.path(), "garbage\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        store.append(new ConversationTurn(Instant.EPOCH, "q2", "a2"));

        assertThat(store.list()).extracting(ConversationTurn::prompt).containsExactly("q1", "q2");
    }

    @Test
    void shouldRejectUnsafeIds() {
        assertThatThrownBy(() -> new FileSessionStore(tempDir, "../escape")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileSessionStore(tempDir, "")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileSessionStore(tempDir, "a b")).isInstanceOf(IllegalArgumentException.class);
    }
}
