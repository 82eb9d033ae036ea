package net.dbbeat.core.schedule;

import java.time.Instant;

/** Due-ness algorithm of one schedule definition (fixed interval or crontab). */
public interface ScheduleExpression {

    DueCheck isDue(Instant lastFiredAt, Instant now);

    /** Stand-in for a job that never fired, so that it is eligible right away. */
    Instant assumedLastFired(Instant now);
}
