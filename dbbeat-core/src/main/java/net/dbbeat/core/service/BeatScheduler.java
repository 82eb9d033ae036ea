package net.dbbeat.core.service;

import net.dbbeat.core.model.PeriodicJob;
import net.dbbeat.core.schedule.DueCheck;
import net.dbbeat.core.schedule.ScheduleResolver;
import net.dbbeat.core.spi.ChangeMarkerRepository;
import net.dbbeat.core.spi.Clock;
import net.dbbeat.core.spi.PeriodicJobRepository;
import net.dbbeat.core.spi.TaskDispatcher;
import net.dbbeat.core.spi.TxRunner;
import net.dbbeat.core.sync.ScheduleSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * The scheduler control loop. Holds the name-keyed table of {@link JobEntry}s
 * loaded from the database, dispatches whatever is due on every tick and
 * sleeps until the earliest re-check (bounded by {@link BeatSettings#maxInterval()}).
 *
 * <p>One instance owns its table, its dirty set and its change baseline; there
 * is no shared static state, so several schedulers can live side by side.
 *
 * <p>Firing is at-most-once: an entry advances (last fired = now, count + 1)
 * even when the dispatcher rejected the submission.
 */
public final class BeatScheduler implements Runnable, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BeatScheduler.class);

    private final PeriodicJobRepository jobs;
    private final TaskDispatcher dispatcher;
    private final TxRunner tx;
    private final Clock clock;
    private final ScheduleResolver resolver;
    private final BeatSettings settings;
    private final ScheduleSync sync;

    private final Map<String, JobEntry> table = new LinkedHashMap<>();
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile SchedulerState state = SchedulerState.INITIALIZING;
    private boolean reloadPending = true;   // 첫 tick 에서 반드시 로드
    private boolean closed;
    private Instant lastChangeCheck;
    private Instant lastSync;

    public BeatScheduler(PeriodicJobRepository jobs,
                         ChangeMarkerRepository markers,
                         TaskDispatcher dispatcher,
                         TxRunner tx,
                         Clock clock,
                         ScheduleResolver resolver,
                         BeatSettings settings) {
        this.jobs = jobs;
        this.dispatcher = dispatcher;
        this.tx = tx;
        this.clock = clock;
        this.resolver = resolver;
        this.settings = settings;
        this.sync = new ScheduleSync(markers, jobs, tx);
    }

    /** Runs ticks until {@link #stop()} or interruption, then performs the final sync. */
    @Override
    public void run() {
        log.info("dbbeat scheduler started: maxInterval={}, syncEvery={}, changeCheckInterval={}",
                settings.maxInterval(), settings.syncEvery(), settings.changeCheckInterval());
        try {
            while (stopSignal.getCount() > 0) {
                Duration wait;
                try {
                    wait = tick();
                } catch (RuntimeException e) {
                    log.error("scheduler tick failed", e);
                    wait = settings.maxInterval();
                }
                if (awaitStop(wait)) break;
            }
        } finally {
            close();
        }
    }

    /** Wakes a sleeping {@link #run()} loop and makes it exit. */
    public void stop() {
        stopSignal.countDown();
    }

    private boolean awaitStop(Duration wait) {
        try {
            return stopSignal.await(Math.max(0L, wait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * One pass: reload when needed, dispatch every due entry, flush run stats
     * when {@code syncEvery} elapsed.
     *
     * @return how long the loop may sleep before the next tick
     */
    public synchronized Duration tick() {
        if (closed) throw new IllegalStateException("scheduler is closed");
        refreshIfNeeded(clock.now());

        state = SchedulerState.IDLE;
        double wait = DueCheck.seconds(settings.maxInterval());
        for (JobEntry entry : new ArrayList<>(table.values())) {
            final DueCheck check;
            try {
                check = entry.isDue();
            } catch (RuntimeException e) {
                log.error("due check of '{}' failed, skipping this tick", entry.name(), e);
                continue;
            }
            if (check.due()) {
                dispatch(entry);
            }
            wait = Math.min(wait, check.nextCheckSeconds());
        }

        Instant now = clock.now();
        if (sync.dirtyCount() > 0
                && (lastSync == null || !now.isBefore(lastSync.plus(settings.syncEvery())))) {
            syncNow();
        }
        state = SchedulerState.IDLE;

        Duration next = new DueCheck(false, wait).nextCheck();
        log.debug("tick done: {} entries, next check in {} ms", table.size(), next.toMillis());
        return next;
    }

    private void refreshIfNeeded(Instant now) {
        if (reloadPending) {
            reload(now);
            return;
        }
        if (lastChangeCheck == null || !now.isBefore(lastChangeCheck.plus(settings.changeCheckInterval()))) {
            lastChangeCheck = now;
            if (sync.hasChanged()) {
                log.info("periodic job configuration changed, reloading");
                reload(now);
            }
        }
    }

    private void reload(Instant now) {
        // reload 전에 반드시 dirty 통계부터 flush
        syncNow();

        state = SchedulerState.RELOADING;
        try {
            // baseline 을 먼저 읽어야 로드 도중의 변경을 다음 체크에서 놓치지 않는다
            sync.captureBaseline();
            List<PeriodicJob> loaded = tx.required(jobs::findAllEnabled);

            Map<String, JobEntry> fresh = new LinkedHashMap<>();
            for (PeriodicJob job : loaded) {
                try {
                    fresh.put(job.name(), JobEntry.of(carryUnsavedStats(job), resolver, clock));
                } catch (RuntimeException e) {
                    // 한 행이 나머지 잡 로드를 막지 않도록 잡 단위로 격리
                    log.error("skipping malformed periodic job '{}': {}", job.name(), e.toString());
                }
            }
            table.clear();
            table.putAll(fresh);
            reloadPending = false;
            lastChangeCheck = now;
            log.info("loaded {} periodic job(s) from database", table.size());
        } catch (Exception e) {
            reloadPending = true;
            log.error("could not load periodic jobs, keeping {} entries and retrying next tick", table.size(), e);
        }
    }

    /** Stats still dirty after a failed flush win over the stale row just read. */
    private PeriodicJob carryUnsavedStats(PeriodicJob job) {
        JobEntry previous = table.get(job.name());
        if (previous == null || !sync.isDirty(job.name())) return job;
        return job.withRunStats(previous.lastFiredAt(), previous.totalFireCount());
    }

    private void dispatch(JobEntry entry) {
        state = SchedulerState.DISPATCHING;
        try {
            String invocationId = dispatcher.submit(
                    entry.target(), entry.job().args(), entry.job().kwargs(), entry.dispatchOptions());
            log.info("sent periodic job '{}' ({}) id={}", entry.name(), entry.target(), invocationId);
        } catch (Exception e) {
            // at-most-once: 큐가 거절해도 발화한 것으로 기록
            log.error("dispatch of periodic job '{}' ({}) failed, counted as fired", entry.name(), entry.target(), e);
        }
        JobEntry next = entry.advance();
        table.put(next.name(), next);
        sync.markDirty(next.name());
    }

    /** Flushes dirty run statistics now. */
    public synchronized int syncNow() {
        if (sync.dirtyCount() == 0) {
            lastSync = clock.now();
            return 0;
        }
        SchedulerState previous = state;
        state = SchedulerState.SYNCING;
        try {
            return sync.flush(table);
        } finally {
            lastSync = clock.now();
            state = previous;
        }
    }

    /** Final sync; the loop cannot be ticked afterwards. */
    @Override
    public synchronized void close() {
        if (closed) return;
        int saved = syncNow();
        closed = true;
        state = SchedulerState.STOPPED;
        stopSignal.countDown();
        log.info("dbbeat scheduler stopped ({} run stat(s) flushed, {} still dirty)", saved, sync.dirtyCount());
    }

    public SchedulerState state() {
        return state;
    }

    public synchronized List<JobEntry> entries() {
        return List.copyOf(table.values());
    }

    public synchronized List<JobEntry> entriesForTarget(String target) {
        List<JobEntry> out = new ArrayList<>();
        for (JobEntry e : table.values()) {
            if (e.matchesTarget(target)) out.add(e);
        }
        return out;
    }

    public synchronized JobEntry entry(String name) {
        return table.get(name);
    }

    public ScheduleSync sync() {
        return sync;
    }

    public BeatSettings settings() {
        return settings;
    }
}
