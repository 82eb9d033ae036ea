package net.dbbeat.core.service;

import net.dbbeat.core.model.CrontabSchedule;
import net.dbbeat.core.model.IntervalSchedule;
import net.dbbeat.core.model.IntervalUnit;
import net.dbbeat.core.model.NewPeriodicJob;
import net.dbbeat.core.model.PeriodicJob;
import net.dbbeat.core.schedule.ScheduleResolver;
import net.dbbeat.core.spi.ChangeMarkerRepository;
import net.dbbeat.core.spi.Clock;
import net.dbbeat.core.spi.CrontabScheduleRepository;
import net.dbbeat.core.spi.IntervalScheduleRepository;
import net.dbbeat.core.spi.PeriodicJobRepository;
import net.dbbeat.core.spi.TaskDispatcher;
import net.dbbeat.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Validated mutations of jobs and schedules for the admin layer.
 * Every successful mutation bumps the change marker as its last step, inside
 * the same transaction, so running schedulers pick it up on their next check.
 */
public final class PeriodicJobAdminService {
    private static final Logger log = LoggerFactory.getLogger(PeriodicJobAdminService.class);

    private final PeriodicJobRepository jobs;
    private final IntervalScheduleRepository intervals;
    private final CrontabScheduleRepository crontabs;
    private final ChangeMarkerRepository marker;
    private final TaskDispatcher dispatcher;
    private final TxRunner tx;
    private final Clock clock;
    private final ScheduleResolver resolver;

    public PeriodicJobAdminService(PeriodicJobRepository jobs,
                                   IntervalScheduleRepository intervals,
                                   CrontabScheduleRepository crontabs,
                                   ChangeMarkerRepository marker,
                                   TaskDispatcher dispatcher,
                                   TxRunner tx,
                                   Clock clock,
                                   ScheduleResolver resolver) {
        this.jobs = jobs;
        this.intervals = intervals;
        this.crontabs = crontabs;
        this.marker = marker;
        this.dispatcher = dispatcher;
        this.tx = tx;
        this.clock = clock;
        this.resolver = resolver;
    }

    // ---------- interval ----------

    /** Returns the existing row for a duplicate (every, unit). */
    public IntervalSchedule createInterval(long every, IntervalUnit unit) throws Exception {
        if (every <= 0) throw new IllegalArgumentException("every must be positive: " + every);
        Objects.requireNonNull(unit, "unit");
        new IntervalSchedule(null, every, unit).period();   // overflow 검사
        return tx.required(() -> {
            IntervalSchedule s = intervals.getOrCreate(every, unit);
            marker.touch(clock.now());
            return s;
        });
    }

    public IntervalSchedule createInterval(long every, String unitCode) throws Exception {
        return createInterval(every, IntervalUnit.from(unitCode));
    }

    public Optional<IntervalSchedule> findInterval(long id) throws Exception {
        return tx.required(() -> intervals.findById(id));
    }

    public List<IntervalSchedule> listIntervals() throws Exception {
        return tx.required(intervals::findAll);
    }

    public boolean deleteInterval(long id) throws Exception {
        return tx.required(() -> touchIf(intervals.delete(id)));
    }

    // ---------- crontab ----------

    /** Null fields mean {@code *}; a null timezone means the configured default zone. */
    public CrontabSchedule createCrontab(String minute, String hour, String dayOfMonth,
                                         String monthOfYear, String dayOfWeek, String timezone) throws Exception {
        String zone = timezone == null || timezone.isBlank() ? resolver.defaultZone().getId() : timezone.trim();
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unknown timezone: " + timezone, e);
        }
        CrontabSchedule crontab = CrontabSchedule.ofNew(minute, hour, dayOfMonth, monthOfYear, dayOfWeek, zone);
        resolver.cron().validate(crontab.toCronExpression());

        return tx.required(() -> {
            CrontabSchedule saved = crontabs.insert(crontab);
            marker.touch(clock.now());
            return saved;
        });
    }

    public Optional<CrontabSchedule> findCrontab(long id) throws Exception {
        return tx.required(() -> crontabs.findById(id));
    }

    public List<CrontabSchedule> listCrontabs() throws Exception {
        return tx.required(crontabs::findAll);
    }

    public boolean deleteCrontab(long id) throws Exception {
        return tx.required(() -> touchIf(crontabs.delete(id)));
    }

    // ---------- periodic job ----------

    /**
     * @throws IllegalArgumentException on invalid fields or unknown schedule ids
     * @throws IllegalStateException    when the name is taken
     */
    public PeriodicJob createJob(NewPeriodicJob req) throws Exception {
        requireText(req.name(), "name");
        requireText(req.target(), "target");
        if ((req.intervalId() == null) == (req.crontabId() == null)) {
            throw new IllegalArgumentException("exactly one of intervalId/crontabId is required");
        }
        validatePriority(req.priority());
        validateExpireSeconds(req.expireSeconds());

        return tx.required(() -> {
            if (jobs.findByName(req.name()).isPresent()) {
                throw new IllegalStateException("periodic job already exists: " + req.name());
            }
            IntervalSchedule interval = req.intervalId() == null ? null : loadInterval(req.intervalId());
            CrontabSchedule crontab = req.crontabId() == null ? null : loadCrontab(req.crontabId());
            Instant now = clock.now();

            PeriodicJob saved = jobs.insert(new PeriodicJob(
                    null, req.name(), req.target(), interval, crontab,
                    req.args(), req.kwargs(), req.queue(), req.priority(),
                    req.expires(), req.expireSeconds(), req.oneOff(), req.startTime(), req.enabled(),
                    null, 0L, req.description(), now, now));
            marker.touch(now);
            log.info("periodic job created: '{}' -> {} ({})", saved.name(), saved.target(), saved.scheduleDisplay());
            return saved;
        });
    }

    public Optional<PeriodicJob> findJob(long id) throws Exception {
        return tx.required(() -> jobs.findById(id));
    }

    public Optional<PeriodicJob> findJobByName(String name) throws Exception {
        return tx.required(() -> jobs.findByName(name));
    }

    /** @param enabled null = all */
    public List<PeriodicJob> listJobs(Boolean enabled, int limit, int offset) throws Exception {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset must not be negative: " + offset);
        return tx.required(() -> jobs.findAll(enabled, limit, offset));
    }

    /**
     * Applies {@code mutation} to the stored job. Schedules are re-read by id,
     * and a changed schedule reference resets {@code lastFiredAt} so the new
     * schedule is evaluated from scratch. Run statistics and identity fields
     * cannot be changed here.
     *
     * @return empty when no job has this id
     */
    public Optional<PeriodicJob> updateJob(long id, UnaryOperator<PeriodicJob> mutation) throws Exception {
        return tx.required(() -> {
            Optional<PeriodicJob> found = jobs.findById(id);
            if (found.isEmpty()) return Optional.<PeriodicJob>empty();
            PeriodicJob current = found.get();

            PeriodicJob changed = Objects.requireNonNull(mutation.apply(current), "mutation result");
            requireText(changed.name(), "name");
            requireText(changed.target(), "target");
            if (!changed.hasSingleSchedule()) {
                throw new IllegalArgumentException("exactly one of interval/crontab is required");
            }
            validatePriority(changed.priority());
            validateExpireSeconds(changed.expireSeconds());
            if (!changed.name().equals(current.name())) {
                Optional<PeriodicJob> other = jobs.findByName(changed.name());
                if (other.isPresent() && !other.get().id().equals(current.id())) {
                    throw new IllegalStateException("periodic job already exists: " + changed.name());
                }
            }

            IntervalSchedule interval = changed.intervalId() == null ? null : loadInterval(changed.intervalId());
            CrontabSchedule crontab = changed.crontabId() == null ? null : loadCrontab(changed.crontabId());
            boolean scheduleChanged = !Objects.equals(current.intervalId(), changed.intervalId())
                    || !Objects.equals(current.crontabId(), changed.crontabId());
            Instant now = clock.now();

            PeriodicJob toSave = changed
                    .withSchedule(interval, crontab)
                    .withRunStats(scheduleChanged ? null : current.lastFiredAt(), current.totalFireCount())
                    .withIdentity(current.id(), current.createdAt(), now);
            jobs.update(toSave);
            marker.touch(now);
            if (scheduleChanged) {
                log.info("periodic job '{}' moved to {}, last fired reset", toSave.name(), toSave.scheduleDisplay());
            }
            return Optional.of(toSave);
        });
    }

    public boolean deleteJob(long id) throws Exception {
        return tx.required(() -> touchIf(jobs.delete(id)));
    }

    public boolean enableJob(long id) throws Exception {
        return updateJob(id, j -> j.withEnabled(true)).isPresent();
    }

    public boolean disableJob(long id) throws Exception {
        return updateJob(id, j -> j.withEnabled(false)).isPresent();
    }

    /**
     * Submits the job right away, outside its schedule. Run statistics are
     * left alone.
     *
     * @return the invocation id, empty when no job has this id
     */
    public Optional<String> runNow(long id) throws Exception {
        Optional<PeriodicJob> found = findJob(id);
        if (found.isEmpty()) return Optional.empty();
        PeriodicJob job = found.get();
        String invocationId = dispatcher.submit(job.target(), job.args(), job.kwargs(),
                job.dispatchOptions(clock.now()));
        log.info("periodic job '{}' run manually, id={}", job.name(), invocationId);
        return Optional.ofNullable(invocationId);
    }

    /** Zone applied to crontabs created without a timezone. */
    public ZoneId defaultZone() {
        return resolver.defaultZone();
    }

    // ---------- helpers ----------

    private boolean touchIf(boolean deleted) throws Exception {
        if (deleted) marker.touch(clock.now());
        return deleted;
    }

    private IntervalSchedule loadInterval(long id) throws Exception {
        return intervals.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("unknown interval schedule id: " + id));
    }

    private CrontabSchedule loadCrontab(long id) throws Exception {
        return crontabs.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("unknown crontab schedule id: " + id));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(field + " is required");
    }

    private static void validatePriority(Integer priority) {
        if (priority != null && (priority < PeriodicJob.MIN_PRIORITY || priority > PeriodicJob.MAX_PRIORITY)) {
            throw new IllegalArgumentException("priority must be between 0 and 9: " + priority);
        }
    }

    private static void validateExpireSeconds(Integer expireSeconds) {
        if (expireSeconds != null && expireSeconds <= 0) {
            throw new IllegalArgumentException("expireSeconds must be positive: " + expireSeconds);
        }
    }
}
