package net.dbbeat.core.schedule;

import net.dbbeat.core.model.PeriodicJob;
import net.dbbeat.core.spi.CronCalculator;

import java.time.ZoneId;
import java.util.Objects;

/** Picks the expression variant from whichever schedule reference the job carries. */
public final class ScheduleResolver {
    private final CronCalculator cron;
    private final ZoneId defaultZone;

    public ScheduleResolver(CronCalculator cron, ZoneId defaultZone) {
        this.cron = Objects.requireNonNull(cron, "cron");
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone");
    }

    /** @throws IllegalArgumentException when the job has no schedule or both */
    public ScheduleExpression resolve(PeriodicJob job) {
        if (!job.hasSingleSchedule()) {
            throw new IllegalArgumentException("job '" + job.name()
                    + "' must reference exactly one of interval/crontab (interval=" + job.intervalId()
                    + ", crontab=" + job.crontabId() + ")");
        }
        if (job.interval() != null) {
            return new IntervalExpression(job.interval().period());
        }
        return CrontabExpression.of(job.crontab(), cron, defaultZone);
    }

    public CronCalculator cron() {
        return cron;
    }

    public ZoneId defaultZone() {
        return defaultZone;
    }
}
