package net.dbbeat.core.schedule;

import java.time.Duration;

/**
 * Answer of a due-check: whether to fire now and how many seconds may pass
 * before the caller has to ask again. The wait is an upper bound for the next
 * check, not an exact wake-up time.
 */
public record DueCheck(boolean due, double nextCheckSeconds) {

    public static DueCheck due(double nextCheckSeconds) {
        return new DueCheck(true, nextCheckSeconds);
    }

    public static DueCheck notDue(double nextCheckSeconds) {
        return new DueCheck(false, nextCheckSeconds);
    }

    public Duration nextCheck() {
        return Duration.ofNanos(Math.max(0L, Math.round(nextCheckSeconds * 1_000_000_000d)));
    }

    public static double seconds(Duration d) {
        // toNanos() 는 약 292년을 넘으면 overflow
        return d.getSeconds() + d.getNano() / 1_000_000_000d;
    }
}
