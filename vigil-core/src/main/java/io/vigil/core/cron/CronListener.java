package io.vigil.core.cron;

import io.vigil.core.delivery.ConnectorRegistry;
import io.vigil.core.delivery.DeliveryTarget;
import io.vigil.core.engine.AskOptions;
import io.vigil.core.engine.ConversationEngine;
import io.vigil.core.engine.EngineResult;
import io.vigil.core.eventlog.EventLog;
import io.vigil.core.eventlog.EventLogEntry;
import io.vigil.core.eventlog.Subscription;
import io.vigil.core.session.SessionStore;
import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CronListener implements AutoCloseable {
    public static final String DONE_EVENT = "cron.done";
    public static final String ERROR_EVENT = "cron.error";
    static final String HISTORY_PREAMBLE =
        "The following is the recent cron session conversation. This is an automated cron job execution.";

    private static final Logger LOG = LoggerFactory.getLogger(CronListener.class);

    private final EventLog eventLog;
    private final ConversationEngine engine;
    private final SessionStore session;
    private final ConnectorRegistry connectors;
    private final Set<String> excludedJobNames;
    private final Executor executor;
    private final Clock clock;
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private Subscription subscription;

    public CronListener(
        EventLog eventLog,
        ConversationEngine engine,
        SessionStore session,
        ConnectorRegistry connectors,
        Set<String> excludedJobNames,
        Clock clock
    ) {
        this(eventLog, engine, session, connectors, excludedJobNames, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "vigil-cron-listener");
            thread.setDaemon(true);
            return thread;
        }), clock);
    }

    public CronListener(
        EventLog eventLog,
        ConversationEngine engine,
        SessionStore session,
        ConnectorRegistry connectors,
        Set<String> excludedJobNames,
        Executor executor,
        Clock clock
    ) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.connectors = Objects.requireNonNull(connectors, "connectors must not be null");
        this.excludedJobNames = excludedJobNames == null ? Set.of() : Set.copyOf(excludedJobNames);
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = eventLog.subscribeType(CronEngine.FIRE_EVENT, this::onFire);
        LOG.info("Cron listener started");
    }

    public synchronized void stop() {
        if (subscription == null) {
            return;
        }
        subscription.close();
        subscription = null;
        LOG.info("Cron listener stopped");
    }

    @Override
    public void close() {
        stop();
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    public boolean isProcessing() {
        return processing.get();
    }

    private void onFire(EventLogEntry entry) {
        CronFirePayload fire = CronFirePayload.from(entry.payload());
        if (excludedJobNames.contains(fire.jobName())) {
            return;
        }
        if (!processing.compareAndSet(false, true)) {
            LOG.warn("Cron job {} ({}) fired while another job is running, skipping", fire.jobId(), fire.jobName());
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    handle(fire);
                } finally {
                    processing.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            processing.set(false);
            LOG.warn("Cron listener is shut down, dropping job {}", fire.jobId(), e);
        }
    }

    private void handle(CronFirePayload fire) {
        long started = clock.millis();
        EngineResult result;
        try {
            result = engine.askWithSession(fire.payload(), session, new AskOptions(HISTORY_PREAMBLE));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Cron job {} ({}) failed", fire.jobId(), fire.jobName(), e);
            Map<String, Object> payload = basePayload(fire);
            payload.put("error", String.valueOf(e.getMessage()));
            payload.put("durationMs", clock.millis() - started);
            record(ERROR_EVENT, payload);
            return;
        }

        deliver(fire, result.text());
        Map<String, Object> payload = basePayload(fire);
        payload.put("reply", result.text());
        payload.put("durationMs", clock.millis() - started);
        record(DONE_EVENT, payload);
    }

    private void deliver(CronFirePayload fire, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        DeliveryTarget target = connectors.resolveDeliveryTarget().orElse(null);
        if (target == null) {
            LOG.debug("No delivery target for cron job {}", fire.jobId());
            return;
        }
        try {
            target.deliver(text);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to deliver cron job {} reply to {}", fire.jobId(), target.channel(), e);
        }
    }

    private void record(String type, Map<String, Object> payload) {
        try {
            eventLog.append(type, payload);
        } catch (IOException e) {
            LOG.warn("Failed to record {}", type, e);
        }
    }

    private static Map<String, Object> basePayload(CronFirePayload fire) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", fire.jobId());
        payload.put("jobName", fire.jobName());
        return payload;
    }
}
