package net.dbbeat.core.service;

import net.dbbeat.core.model.DispatchOptions;
import net.dbbeat.core.model.IntervalUnit;
import net.dbbeat.core.model.PeriodicJob;
import net.dbbeat.core.schedule.DueCheck;
import net.dbbeat.core.schedule.ScheduleResolver;
import net.dbbeat.core.support.Jobs;
import net.dbbeat.core.support.MinuteCronCalculator;
import net.dbbeat.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobEntryTest {

    final MutableClock clock = MutableClock.at("2024-03-01T10:15:00Z");
    final ScheduleResolver resolver = new ScheduleResolver(new MinuteCronCalculator(), ZoneOffset.UTC);

    JobEntry entry(PeriodicJob job) {
        return JobEntry.of(job, resolver, clock);
    }

    @Test
    void ping_firstCheckIsDue_successorWaitsFullPeriod() {
        JobEntry ping = entry(Jobs.interval("ping", "noop", 10, IntervalUnit.SECONDS));

        assertTrue(ping.isDue().due());

        JobEntry next = ping.advance();
        DueCheck r = next.isDue();
        assertFalse(r.due());
        assertEquals(10.0, r.nextCheckSeconds(), 1e-6);
        assertEquals(clock.now(), next.lastFiredAt());
        assertEquals(1, next.totalFireCount());
    }

    @Test
    void disabled_isAlwaysNotDue_withFiveSecondRecheck() {
        PeriodicJob base = Jobs.everySeconds("d", 1);
        List<PeriodicJob> variants = List.of(
                Jobs.with(base, false, null, null, false),
                Jobs.with(base.withRunStats(clock.now().minusSeconds(3600), 4), false, null, null, false),
                Jobs.with(Jobs.crontab("c", "*", "UTC"), false, null, null, false),
                Jobs.with(base, true, clock.now().plusSeconds(60), clock.now().minusSeconds(1), false));

        for (PeriodicJob job : variants) {
            assertEquals(DueCheck.notDue(5.0), entry(job).isDue(), job.toString());
        }
    }

    @Test
    void startTimeInFuture_waitsRemainingSeconds() {
        PeriodicJob job = Jobs.with(Jobs.everySeconds("s", 10), false, clock.now().plusSeconds(30), null, true);

        assertEquals(DueCheck.notDue(30.0), entry(job).isDue());
    }

    @Test
    void startTimeAlmostReached_waitsAtLeastOneSecond() {
        PeriodicJob job = Jobs.with(Jobs.everySeconds("s", 10), false, clock.now().plusMillis(200), null, true);

        assertEquals(DueCheck.notDue(1.0), entry(job).isDue());
    }

    @Test
    void startTimeReached_scheduleDecides() {
        PeriodicJob job = Jobs.with(Jobs.everySeconds("s", 10), false, clock.now().minusSeconds(1), null, true);

        assertTrue(entry(job).isDue().due());
    }

    @Test
    void expiredAnHourAgo_neverDue_dailyRecheck() {
        PeriodicJob interval = Jobs.with(Jobs.everySeconds("e", 1), false, null, clock.now().minus(Duration.ofHours(1)), true);
        PeriodicJob crontab = Jobs.with(Jobs.crontab("c", "*", "UTC"), false, null, clock.now().minus(Duration.ofHours(1)), true);

        for (PeriodicJob job : List.of(interval, crontab, interval.withRunStats(clock.now().minusSeconds(99), 3))) {
            assertEquals(DueCheck.notDue(86_400.0), entry(job).isDue());
        }
    }

    @Test
    void oneOff_firesExactlyOnce() {
        JobEntry once = entry(Jobs.with(Jobs.everySeconds("o", 10), true, null, null, true));
        assertTrue(once.isDue().due());

        JobEntry fired = once.advance();
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofDays(2));
            assertEquals(DueCheck.notDue(86_400.0), fired.isDue());
        }
    }

    @Test
    void advance_isPure() {
        JobEntry original = entry(Jobs.everySeconds("p", 10));

        JobEntry a = original.advance();
        clock.advanceSeconds(1);
        JobEntry b = original.advance();

        assertEquals(0, original.totalFireCount());
        assertNull(original.lastFiredAt());
        assertEquals(1, a.totalFireCount());
        assertEquals(1, b.totalFireCount());
        assertNotEquals(a.lastFiredAt(), b.lastFiredAt());
        assertNotSame(a, b);
    }

    @Test
    void matchesTarget_comparesTargetIdentifier() {
        JobEntry e = entry(Jobs.interval("nightly-report", "reports.build", 1, IntervalUnit.DAYS));

        assertTrue(e.matchesTarget("reports.build"));
        assertFalse(e.matchesTarget("nightly-report"));
        assertFalse(e.matchesTarget(null));
    }

    @Test
    void dispatchOptions_relativeExpiryFromNow() {
        PeriodicJob base = Jobs.everySeconds("x", 10);
        PeriodicJob job = new PeriodicJob(null, "x", "noop", base.interval(), null, List.of(1), Map.of("k", "v"),
                "reports", 7, null, 60, false, null, true, null, 0L, null, Instant.EPOCH, Instant.EPOCH);

        DispatchOptions o = entry(job).dispatchOptions();

        assertEquals("reports", o.queue());
        assertEquals(7, o.priority());
        assertEquals(clock.now().plusSeconds(60), o.expires());
    }

    @Test
    void malformedJob_rejectedAtConstruction() {
        assertThrows(IllegalArgumentException.class, () -> entry(Jobs.job("bad", "noop", null, null)));
    }
}
