package io.vigil.core.cron;

import static org.assertj.core.api.Assertions.assertThat;

import io.vigil.core.InMemorySessionStore;
import io.vigil.core.RecordingConnector;
import io.vigil.core.ScriptedEngine;
import io.vigil.core.delivery.ConnectorRegistry;
import io.vigil.core.engine.AskOptions;
import io.vigil.core.engine.ConversationEngine;
import io.vigil.core.engine.EngineResult;
import io.vigil.core.eventlog.EventLogEntry;
import io.vigil.core.eventlog.EventQuery;
import io.vigil.core.eventlog.FileEventLog;
import io.vigil.core.session.SessionStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CronListenerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private FileEventLog log;
    private ConnectorRegistry connectors;
    private RecordingConnector telegram;
    private InMemorySessionStore session;

    @BeforeEach
    void setUp() throws Exception {
        log = FileEventLog.open(tempDir.resolve("events.jsonl"), 100, CLOCK);
        connectors = new ConnectorRegistry(CLOCK);
        telegram = new RecordingConnector("telegram");
        connectors.register(telegram);
        session = new InMemorySessionStore("cron/default");
    }

    @AfterEach
    void tearDown() {
        log.close();
    }

    @Test
    void shouldAnswerFireEventDeliverAndRecordDone() throws Exception {
        ScriptedEngine engine = new ScriptedEngine().reply("Water the plants");
        connectors.touchInteraction("telegram", "chat-42");
        CronListener listener = new CronListener(log, engine, session, connectors, Set.of(), Runnable::run, CLOCK);
        listener.start();

        log.append(CronEngine.FIRE_EVENT, new CronFirePayload("j1", "plants", "remind me about plants"));

        assertThat(engine.prompts()).containsExactly("remind me about plants");
        assertThat(engine.options()).containsExactly(new AskOptions(CronListener.HISTORY_PREAMBLE));
        assertThat(session.list()).hasSize(1);
        assertThat(telegram.sent()).containsExactly("chat-42: Water the plants");

        List<EventLogEntry> done = log.recent(EventQuery.ofType(CronListener.DONE_EVENT));
        assertThat(done).hasSize(1);
        assertThat(done.get(0).payload().path("jobId").asText()).isEqualTo("j1");
        assertThat(done.get(0).payload().path("jobName").asText()).isEqualTo("plants");
        assertThat(done.get(0).payload().path("reply").asText()).isEqualTo("Water the plants");
        assertThat(done.get(0).payload().has("durationMs")).isTrue();
        assertThat(listener.isProcessing()).isFalse();
    }

    @Test
    void shouldRecordErrorWhenEngineFails() throws Exception {
        ScriptedEngine engine = new ScriptedEngine().fail("Error calling LLM: timeout");
        CronListener listener = new CronListener(log, engine, session, connectors, Set.of(), Runnable::run, CLOCK);
        listener.start();

        log.append(CronEngine.FIRE_EVENT, new CronFirePayload("j1", "plants", "x"));

        List<EventLogEntry> errors = log.recent(EventQuery.ofType(CronListener.ERROR_EVENT));
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).payload().path("error").asText()).contains("timeout");
        assertThat(log.recent(EventQuery.ofType(CronListener.DONE_EVENT))).isEmpty();
        assertThat(telegram.sent()).isEmpty();
        assertThat(listener.isProcessing()).isFalse();
    }

    @Test
    void deliveryFailureShouldStillRecordDone() throws Exception {
        telegram.failing(true);
        CronListener listener = new CronListener(log, new ScriptedEngine().reply("hi"), session, connectors, Set.of(), Runnable::run, CLOCK);
        listener.start();

        log.append(CronEngine.FIRE_EVENT, new CronFirePayload("j1", "greet", "say hi"));

        assertThat(log.recent(EventQuery.ofType(CronListener.DONE_EVENT))).hasSize(1);
    }

    @Test
    void shouldIgnoreExcludedJobsAndStopListening() throws Exception {
        ScriptedEngine engine = new ScriptedEngine();
        CronListener listener = new CronListener(log, engine, session, connectors, Set.of("__heartbeat__"), Runnable::run, CLOCK);
        listener.start();
        listener.start();

        log.append(CronEngine.FIRE_EVENT, new CronFirePayload("hb", "__heartbeat__", "check"));
        assertThat(engine.prompts()).isEmpty();

        log.append(CronEngine.FIRE_EVENT, new CronFirePayload("j2", "other", "ping"));
        assertThat(engine.prompts()).containsExactly("ping");

        listener.stop();
        log.append(CronEngine.FIRE_EVENT, new CronFirePayload("j2", "other", "pong"));
        assertThat(engine.prompts()).containsExactly("ping");
    }

    @Test
    void shouldDropFiresWhileBusy() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        ConversationEngine blocking = new ConversationEngine() {
            @Override
            public EngineResult ask(String prompt) {
                return EngineResult.text(prompt);
            }

            @Override
            public EngineResult askWithSession(String prompt, SessionStore store, AskOptions options) {
                calls.incrementAndGet();
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return EngineResult.text("done " + prompt);
            }
        };
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CronListener listener = new CronListener(log, blocking, session, connectors, Set.of(), executor, CLOCK);
        try {
            listener.start();
            log.append(CronEngine.FIRE_EVENT, new CronFirePayload("j1", "slow", "first"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(listener.isProcessing()).isTrue();

            log.append(CronEngine.FIRE_EVENT, new CronFirePayload("j2", "slow", "second"));
            release.countDown();

            long deadline = System.currentTimeMillis() + 5_000;
            while (listener.isProcessing() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            listener.close();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertThat(calls.get()).isEqualTo(1);
        assertThat(log.recent(EventQuery.ofType(CronListener.DONE_EVENT)))
            .extracting(entry -> entry.payload().path("reply").asText())
            .containsExactly("done first");
    }

    @Test
    void shouldHandleFiresFromEngine() throws Exception {
        ScriptedEngine scripted = new ScriptedEngine().reply("report ready");
        CronListener listener = new CronListener(log, scripted, session, connectors, Set.of(), Runnable::run, CLOCK);
        listener.start();
        try (CronEngine cron = new CronEngine(log, new FileCronStore(tempDir.resolve("jobs.json")), CLOCK, ZoneOffset.UTC)) {
            String id = cron.add(new CronJobCreate("report", new CronSchedule.Every("1h"), "build the report"));
            cron.runNow(id);
        }

        assertThat(scripted.prompts()).containsExactly("build the report");
        assertThat(telegram.sent()).containsExactly("default: report ready");
    }
}
