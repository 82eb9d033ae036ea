package net.dbbeat.core.service;

import net.dbbeat.core.model.DispatchOptions;
import net.dbbeat.core.model.PeriodicJob;
import net.dbbeat.core.schedule.DueCheck;
import net.dbbeat.core.schedule.ScheduleExpression;
import net.dbbeat.core.schedule.ScheduleResolver;
import net.dbbeat.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Runtime view of one {@link PeriodicJob}: the persisted definition plus its
 * resolved {@link ScheduleExpression}. Immutable; {@link #advance()} hands out
 * the post-fire successor and leaves this instance untouched.
 */
public final class JobEntry {
    static final double DISABLED_RECHECK_SECONDS = 5.0;
    static final double DORMANT_RECHECK_SECONDS = 86_400.0;
    static final double MIN_START_RECHECK_SECONDS = 1.0;

    private final PeriodicJob job;
    private final ScheduleExpression schedule;
    private final Clock clock;

    public JobEntry(PeriodicJob job, ScheduleExpression schedule, Clock clock) {
        this.job = Objects.requireNonNull(job, "job");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** @throws IllegalArgumentException when the job has no schedule or both */
    public static JobEntry of(PeriodicJob job, ScheduleResolver resolver, Clock clock) {
        return new JobEntry(job, resolver.resolve(job), clock);
    }

    public DueCheck isDue() {
        return isDue(clock.now());
    }

    /**
     * Gates in order, first hit wins: disabled, not started yet, expired,
     * one-off already fired, then the schedule itself.
     */
    DueCheck isDue(Instant now) {
        if (!job.enabled()) {
            return DueCheck.notDue(DISABLED_RECHECK_SECONDS);
        }
        if (job.startTime() != null && now.isBefore(job.startTime())) {
            double remaining = DueCheck.seconds(Duration.between(now, job.startTime()));
            return DueCheck.notDue(Math.max(MIN_START_RECHECK_SECONDS, remaining));
        }
        if (job.expires() != null && !now.isBefore(job.expires())) {
            // 만료된 job 은 삭제하지 않고 휴면 상태로 둔다
            return DueCheck.notDue(DORMANT_RECHECK_SECONDS);
        }
        if (job.oneOff() && job.totalFireCount() > 0) {
            return DueCheck.notDue(DORMANT_RECHECK_SECONDS);
        }
        Instant last = job.lastFiredAt() != null ? job.lastFiredAt() : schedule.assumedLastFired(now);
        return schedule.isDue(last, now);
    }

    /** Successor after one fire: last fired = now, fire count + 1. */
    public JobEntry advance() {
        return new JobEntry(job.withRunStats(clock.now(), job.totalFireCount() + 1), schedule, clock);
    }

    public boolean matchesTarget(String target) {
        return job.target() != null && job.target().equals(target);
    }

    public DispatchOptions dispatchOptions() {
        return job.dispatchOptions(clock.now());
    }

    public String name() {
        return job.name();
    }

    public String target() {
        return job.target();
    }

    public PeriodicJob job() {
        return job;
    }

    public ScheduleExpression schedule() {
        return schedule;
    }

    public Instant lastFiredAt() {
        return job.lastFiredAt();
    }

    public long totalFireCount() {
        return job.totalFireCount();
    }

    @Override
    public String toString() {
        return "JobEntry{" + job.name() + " -> " + job.target() + ", " + job.scheduleDisplay()
                + ", fired=" + job.totalFireCount() + '}';
    }
}
