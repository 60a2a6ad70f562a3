package io.vigil.core.cron;

import io.vigil.core.eventlog.EventLog;
import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the job list and turns due jobs into {@code cron.fire} events on the event log.
 *
 * <p>A single timer is armed for the earliest due job, capped at one minute so clock jumps are
 * noticed. All operations and the timer tick are serialized on this instance. Firing only
 * appends an event; what a job does is up to whoever subscribes to {@link #FIRE_EVENT}.
 */
public final class CronEngine implements AutoCloseable {
    public static final String FIRE_EVENT = "cron.fire";
    static final long MAX_TIMER_DELAY_MS = 60_000L;

    private static final Logger LOG = LoggerFactory.getLogger(CronEngine.class);

    private final EventLog eventLog;
    private final CronStore store;
    private final Clock clock;
    private final ZoneId zone;
    private final ScheduledExecutorService timerExecutor;
    private Map<String, CronJob> jobs = new LinkedHashMap<>();
    private ScheduledFuture<?> timer;
    private boolean loaded;
    private boolean started;
    private boolean stopped;

    public CronEngine(EventLog eventLog, CronStore store, Clock clock, ZoneId zone) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "vigil-cron-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Loads persisted jobs, recomputes stale or missing next-run times from now and arms the timer.
     * One-shot jobs whose time has passed are disabled instead of fired.
     */
    public synchronized void start() throws IOException {
        if (stopped) {
            throw new IllegalStateException("cron engine has been stopped");
        }
        if (started) {
            return;
        }
        ensureLoaded();
        long now = clock.millis();
        Map<String, CronJob> next = new LinkedHashMap<>();
        for (CronJob job : jobs.values()) {
            Long nextRunAtMs = job.state().nextRunAtMs();
            if (job.enabled() && (nextRunAtMs == null || nextRunAtMs < now)) {
                Long recomputed = job.schedule().nextRunAfter(now, zone);
                job = job.withState(job.state().withNextRunAtMs(recomputed));
                if (recomputed == null && job.schedule().oneShot()) {
                    job = job.withEnabled(false);
                }
            }
            next.put(job.id(), job);
        }
        commit(next);
        started = true;
        rearm();
        LOG.info("Cron engine started with {} jobs", jobs.size());
    }

    /**
     * Cancels the timer for good. Jobs stay persisted.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        started = false;
        cancelTimer();
        timerExecutor.shutdownNow();
        LOG.info("Cron engine stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized String add(CronJobCreate create) throws IOException {
        Objects.requireNonNull(create, "create must not be null");
        ensureLoaded();
        long now = clock.millis();
        String id = newId();
        Long nextRunAtMs = create.enabled() ? create.schedule().nextRunAfter(now, zone) : null;
        CronJob job = new CronJob(
            id,
            create.name(),
            create.enabled(),
            create.schedule(),
            create.payload(),
            CronJobState.initial(nextRunAtMs),
            now
        );
        Map<String, CronJob> next = new LinkedHashMap<>(jobs);
        next.put(id, job);
        commit(next);
        rearm();
        LOG.info("Added cron job {} ({}) next run at {}", id, job.name(), nextRunAtMs);
        return id;
    }

    public synchronized CronJob update(String id, CronJobPatch patch) throws IOException {
        Objects.requireNonNull(patch, "patch must not be null");
        CronJob job = require(id);
        long now = clock.millis();
        if (patch.name() != null) {
            job = job.withName(patch.name());
        }
        if (patch.payload() != null) {
            job = job.withPayload(patch.payload());
        }
        if (patch.enabled() != null) {
            job = job.withEnabled(patch.enabled());
        }
        if (patch.schedule() != null) {
            job = job.withSchedule(patch.schedule())
                .withState(job.state()
                    .withNextRunAtMs(patch.schedule().nextRunAfter(now, zone))
                    .withConsecutiveErrors(0));
        } else if (job.enabled() && job.state().nextRunAtMs() == null) {
            job = job.withState(job.state().withNextRunAtMs(job.schedule().nextRunAfter(now, zone)));
        }

        Map<String, CronJob> next = new LinkedHashMap<>(jobs);
        next.put(id, job);
        commit(next);
        rearm();
        return job;
    }

    public synchronized void remove(String id) throws IOException {
        require(id);
        Map<String, CronJob> next = new LinkedHashMap<>(jobs);
        next.remove(id);
        commit(next);
        rearm();
        LOG.info("Removed cron job {}", id);
    }

    public synchronized List<CronJob> list() throws IOException {
        ensureLoaded();
        return List.copyOf(jobs.values());
    }

    public synchronized Optional<CronJob> get(String id) throws IOException {
        ensureLoaded();
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Fires a job immediately regardless of its schedule or enabled flag.
     */
    public synchronized CronJob runNow(String id) throws IOException {
        CronJob job = fire(require(id), clock.millis());
        Map<String, CronJob> next = new LinkedHashMap<>(jobs);
        next.put(id, job);
        commit(next);
        rearm();
        return job;
    }

    /**
     * Fires every enabled job whose next run time has been reached, in list order, and persists
     * the resulting state. Called by the timer; a failed save is logged and retried on the next tick.
     *
     * @return the number of jobs fired
     */
    public synchronized int runDue() throws IOException {
        ensureLoaded();
        long now = clock.millis();
        int count = 0;
        for (CronJob job : new ArrayList<>(jobs.values())) {
            Long nextRunAtMs = job.state().nextRunAtMs();
            if (job.enabled() && nextRunAtMs != null && nextRunAtMs <= now) {
                jobs.put(job.id(), fire(job, now));
                count++;
            }
        }
        if (count > 0) {
            store.save(List.copyOf(jobs.values()));
        }
        return count;
    }

    private CronJob fire(CronJob job, long now) {
        CronJobState state;
        try {
            eventLog.append(FIRE_EVENT, new CronFirePayload(job.id(), job.name(), job.payload()));
            state = job.state().succeeded(now);
            LOG.debug("Fired cron job {} ({})", job.id(), job.name());
        } catch (IOException | RuntimeException e) {
            state = job.state().failed(now);
            LOG.warn("Failed to fire cron job {} ({}), consecutive errors: {}", job.id(), job.name(), state.consecutiveErrors(), e);
        }

        if (job.schedule().oneShot()) {
            return job.withEnabled(false).withState(state.withNextRunAtMs(null));
        }
        Long nextRunAtMs = state.consecutiveErrors() > 0
            ? now + ErrorBackoff.delayMs(state.consecutiveErrors())
            : job.schedule().nextRunAfter(now, zone);
        return job.withState(state.withNextRunAtMs(nextRunAtMs));
    }

    private void onTick() {
        synchronized (this) {
            timer = null;
            if (!started) {
                return;
            }
            try {
                runDue();
            } catch (IOException e) {
                LOG.warn("Failed to persist cron jobs after tick", e);
            } catch (RuntimeException e) {
                LOG.error("Cron tick failed", e);
            } finally {
                rearm();
            }
        }
    }

    private void rearm() {
        if (!started) {
            return;
        }
        cancelTimer();
        Long earliest = null;
        for (CronJob job : jobs.values()) {
            Long nextRunAtMs = job.state().nextRunAtMs();
            if (job.enabled() && nextRunAtMs != null && (earliest == null || nextRunAtMs < earliest)) {
                earliest = nextRunAtMs;
            }
        }
        if (earliest == null) {
            return;
        }
        long delay = Math.max(0, Math.min(earliest - clock.millis(), MAX_TIMER_DELAY_MS));
        timer = timerExecutor.schedule(this::onTick, delay, TimeUnit.MILLISECONDS);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private CronJob require(String id) throws IOException {
        ensureLoaded();
        CronJob job = id == null ? null : jobs.get(id);
        if (job == null) {
            throw new CronJobNotFoundException(id);
        }
        return job;
    }

    private void commit(Map<String, CronJob> next) throws IOException {
        store.save(List.copyOf(next.values()));
        jobs = next;
    }

    private void ensureLoaded() throws IOException {
        if (loaded) {
            return;
        }
        Map<String, CronJob> restored = new LinkedHashMap<>();
        for (CronJob job : store.load()) {
            restored.put(job.id(), job);
        }
        jobs = restored;
        loaded = true;
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (jobs.containsKey(id));
        return id;
    }
}
