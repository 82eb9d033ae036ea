package net.dbbeat.core.schedule;

import net.dbbeat.core.model.CrontabSchedule;
import net.dbbeat.core.support.MinuteCronCalculator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CrontabExpressionTest {

    final MinuteCronCalculator cron = new MinuteCronCalculator();

    CrontabExpression expr(String minute, String timezone) {
        return CrontabExpression.of(new CrontabSchedule(7L, minute, "*", "*", "*", "*", timezone), cron, ZoneOffset.UTC);
    }

    @Test
    void everyMinute_atSecondZero_isDue() {
        Instant now = Instant.parse("2024-03-01T10:15:00Z");

        DueCheck r = expr("*", "UTC").isDue(now.minusSeconds(61), now);

        assertTrue(r.due());
        assertTrue(r.nextCheckSeconds() <= CrontabExpression.MAX_RECHECK_SECONDS);
    }

    @Test
    void everyMinute_atSecondThirty_isNotDue_andRechecksWithinFiveSeconds() {
        Instant now = Instant.parse("2024-03-01T10:15:30Z");

        DueCheck r = expr("*", "UTC").isDue(now.minusSeconds(61), now);

        assertFalse(r.due());
        assertTrue(r.nextCheckSeconds() <= 5.0);
        assertTrue(r.nextCheckSeconds() > 0.0);
    }

    @Test
    void insideOneSecondWindow_isDue() {
        Instant now = Instant.parse("2024-03-01T11:00:00.800Z");

        assertTrue(expr("0", "UTC").isDue(Instant.parse("2024-03-01T10:00:00.300Z"), now).due());
    }

    @Test
    void afterFiringInSlot_notDueAgainInSameSlot() {
        Instant fired = Instant.parse("2024-03-01T11:00:00.300Z");

        DueCheck r = expr("0", "UTC").isDue(fired, Instant.parse("2024-03-01T11:00:00.900Z"));

        assertFalse(r.due());
        assertEquals(5.0, r.nextCheckSeconds(), 1e-9);
    }

    @Test
    void approachingSlot_waitShrinksToRemainingSeconds() {
        Instant now = Instant.parse("2024-03-01T10:59:57Z");

        DueCheck r = expr("0", "UTC").isDue(Instant.parse("2024-03-01T10:00:00Z"), now);

        assertFalse(r.due());
        assertEquals(3.0, r.nextCheckSeconds(), 1e-9);
    }

    @Test
    void missedSlot_isSkipped_notCaughtUp() {
        // 10:00 slot 을 지나쳤고 last fired 는 그 이전
        Instant now = Instant.parse("2024-03-01T10:20:00Z");

        DueCheck r = expr("0", "UTC").isDue(Instant.parse("2024-03-01T09:00:00Z"), now);

        assertFalse(r.due());
    }

    @Test
    void unknownTimezone_neverFires() {
        CrontabExpression e = expr("*", "Mars/Olympus_Mons");
        Instant now = Instant.parse("2024-03-01T10:15:00Z");

        assertFalse(e.evaluable());
        DueCheck r = e.isDue(now.minusSeconds(3600), now);
        assertFalse(r.due());
        assertEquals(5.0, r.nextCheckSeconds(), 1e-9);
    }

    @Test
    void unparseablePattern_neverFires() {
        CrontabExpression e = expr("sixty", "UTC");
        Instant now = Instant.parse("2024-03-01T10:15:00Z");

        assertFalse(e.evaluable());
        assertFalse(e.isDue(now.minusSeconds(3600), now).due());
    }

    @Test
    void blankTimezone_usesDefaultZone() {
        CrontabExpression e = CrontabExpression.of(
                CrontabSchedule.ofNew("*", null, null, null, null, " "), cron, ZoneId.of("Asia/Shanghai"));

        assertEquals(ZoneId.of("Asia/Shanghai"), e.zone());
        assertEquals("* * * * *", e.cronExpr());
    }

    @Test
    void assumedLastFire_isOneDayAgo() {
        Instant now = Instant.parse("2024-03-01T10:15:00Z");

        assertEquals(Instant.parse("2024-02-29T10:15:00Z"), expr("*", "UTC").assumedLastFired(now));
    }
}
