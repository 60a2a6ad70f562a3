package io.vigil.core.heartbeat;

import io.vigil.core.config.ConfigWriter;
import io.vigil.core.cron.CronEngine;
import io.vigil.core.cron.CronFirePayload;
import io.vigil.core.cron.CronJob;
import io.vigil.core.cron.CronJobCreate;
import io.vigil.core.cron.CronJobPatch;
import io.vigil.core.cron.CronSchedule;
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
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic self-check driven by the cron job {@value #JOB_NAME}.
 *
 * <p>Each fire runs the heartbeat prompt through the engine and only reaches the user when the
 * model answers {@code CHAT_YES} with something new. Outcomes are recorded as
 * {@code heartbeat.skip}, {@code heartbeat.done} or {@code heartbeat.error} events.
 */
public final class Heartbeat implements AutoCloseable {
    public static final String JOB_NAME = "__heartbeat__";
    public static final String SKIP_EVENT = "heartbeat.skip";
    public static final String DONE_EVENT = "heartbeat.done";
    public static final String ERROR_EVENT = "heartbeat.error";
    static final String HISTORY_PREAMBLE = "The following is the recent heartbeat conversation history.";

    private static final Logger LOG = LoggerFactory.getLogger(Heartbeat.class);

    private final CronEngine cronEngine;
    private final EventLog eventLog;
    private final ConversationEngine engine;
    private final SessionStore session;
    private final ConnectorRegistry connectors;
    private final ConfigWriter configWriter;
    private final Executor executor;
    private final Clock clock;
    private final HeartbeatDedup dedup = new HeartbeatDedup();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private volatile HeartbeatConfig config;
    private Subscription subscription;
    private String jobId;

    public Heartbeat(
        HeartbeatConfig config,
        CronEngine cronEngine,
        EventLog eventLog,
        ConversationEngine engine,
        SessionStore session,
        ConnectorRegistry connectors,
        ConfigWriter configWriter,
        Clock clock
    ) {
        this(config, cronEngine, eventLog, engine, session, connectors, configWriter,
            Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "vigil-heartbeat");
                thread.setDaemon(true);
                return thread;
            }),
            clock);
    }

    public Heartbeat(
        HeartbeatConfig config,
        CronEngine cronEngine,
        EventLog eventLog,
        ConversationEngine engine,
        SessionStore session,
        ConnectorRegistry connectors,
        ConfigWriter configWriter,
        Executor executor,
        Clock clock
    ) {
        this.config = config == null ? HeartbeatConfig.defaults() : config;
        this.cronEngine = Objects.requireNonNull(cronEngine, "cronEngine must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.connectors = Objects.requireNonNull(connectors, "connectors must not be null");
        this.configWriter = Objects.requireNonNull(configWriter, "configWriter must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registers the job and the fire subscription, also when disabled, so the heartbeat can be
     * switched on later without a restart.
     */
    public synchronized void start() throws IOException {
        ensureJobAndListener();
        LOG.info("Heartbeat started (enabled={}, every={})", config.enabled(), config.every());
    }

    /**
     * Unsubscribes. The cron job is kept so it survives restarts.
     */
    public synchronized void stop() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    @Override
    public void close() {
        stop();
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    public synchronized void setEnabled(boolean enabled) throws IOException {
        config = config.withEnabled(enabled);
        ensureJobAndListener();
        configWriter.writeConfigSection("heartbeat", config);
        LOG.info("Heartbeat {}", enabled ? "enabled" : "disabled");
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    public HeartbeatConfig config() {
        return config;
    }

    public synchronized Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }

    private void ensureJobAndListener() throws IOException {
        CronSchedule schedule = new CronSchedule.Every(config.every());
        Optional<CronJob> existing = cronEngine.list().stream()
            .filter(job -> JOB_NAME.equals(job.name()))
            .findFirst();
        if (existing.isPresent()) {
            jobId = existing.get().id();
            cronEngine.update(jobId, new CronJobPatch(null, schedule, config.prompt(), config.enabled()));
        } else {
            jobId = cronEngine.add(new CronJobCreate(JOB_NAME, schedule, config.prompt(), config.enabled()));
        }
        if (subscription == null) {
            subscription = eventLog.subscribeType(CronEngine.FIRE_EVENT, this::onFire);
        }
    }

    private void onFire(EventLogEntry entry) {
        CronFirePayload fire = CronFirePayload.from(entry.payload());
        if (!JOB_NAME.equals(fire.jobName())) {
            return;
        }
        if (!processing.compareAndSet(false, true)) {
            LOG.debug("Heartbeat already running, dropping fire #{}", entry.seq());
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
            LOG.warn("Heartbeat executor is shut down, dropping fire #{}", entry.seq(), e);
        }
    }

    private void handle(CronFirePayload fire) {
        long started = clock.millis();
        try {
            HeartbeatConfig current = config;
            if (current.activeHours() != null && !current.activeHours().contains(clock.instant(), clock.getZone())) {
                LOG.debug("Heartbeat skipped, outside active hours");
                record(SKIP_EVENT, skip("outside-active-hours", null));
                return;
            }

            EngineResult result = engine.askWithSession(fire.payload(), session, new AskOptions(HISTORY_PREAMBLE));
            long durationMs = clock.millis() - started;
            HeartbeatReply reply = HeartbeatReply.parse(result.text());

            if (reply.status() == HeartbeatStatus.HEARTBEAT_OK || reply.status() == HeartbeatStatus.CHAT_NO) {
                LOG.debug("Heartbeat {}: {} ({}ms)", reply.status(), reply.reason(), durationMs);
                String reason = reply.status() == HeartbeatStatus.HEARTBEAT_OK ? "ack" : "chat-no";
                record(SKIP_EVENT, skip(reason, reply.reason()));
                return;
            }

            String text = reply.content();
            if (text.isBlank()) {
                record(SKIP_EVENT, skip("empty", reply.reason()));
                return;
            }
            if (dedup.isDuplicate(text, clock.millis())) {
                LOG.debug("Heartbeat skipped, duplicate content");
                record(SKIP_EVENT, skip("duplicate", reply.reason()));
                return;
            }

            boolean delivered = deliver(text);
            LOG.info("Heartbeat CHAT_YES delivered={} ({}ms)", delivered, durationMs);
            Map<String, Object> done = new LinkedHashMap<>();
            done.put("reply", text);
            done.put("reason", reply.reason());
            done.put("durationMs", durationMs);
            done.put("delivered", delivered);
            done.put("unparsed", reply.unparsed());
            record(DONE_EVENT, done);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Heartbeat failed", e);
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", String.valueOf(e.getMessage()));
            error.put("durationMs", clock.millis() - started);
            record(ERROR_EVENT, error);
        }
    }

    private boolean deliver(String text) {
        DeliveryTarget target = connectors.resolveDeliveryTarget().orElse(null);
        if (target == null) {
            LOG.warn("Heartbeat has no delivery target");
            return false;
        }
        try {
            target.deliver(text);
            dedup.record(text, clock.millis());
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Heartbeat delivery to {} failed", target.channel(), e);
            return false;
        }
    }

    private void record(String type, Map<String, Object> payload) {
        try {
            eventLog.append(type, payload);
        } catch (IOException e) {
            LOG.warn("Failed to record {}", type, e);
        }
    }

    private static Map<String, Object> skip(String reason, String parsedReason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason);
        if (parsedReason != null) {
            payload.put("parsedReason", parsedReason);
        }
        return payload;
    }
}
