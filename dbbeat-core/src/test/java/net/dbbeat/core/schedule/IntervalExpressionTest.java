package net.dbbeat.core.schedule;

import net.dbbeat.core.model.IntervalUnit;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IntervalExpressionTest {

    static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @ParameterizedTest
    @ValueSource(longs = {2, 10, 59, 3600, 86_400})
    void dueOneSecondAfterPeriod_notDueOneSecondBefore(long n) {
        var expr = new IntervalExpression(IntervalUnit.SECONDS.toDuration(n));

        assertTrue(expr.isDue(NOW.minusSeconds(n + 1), NOW).due());

        DueCheck early = expr.isDue(NOW.minusSeconds(n - 1), NOW);
        assertFalse(early.due());
        assertEquals(1.0, early.nextCheckSeconds(), 1e-9);
    }

    @Test
    void exactlyOnePeriod_isDue_andWaitsFullPeriod() {
        var expr = new IntervalExpression(Duration.ofSeconds(10));

        DueCheck r = expr.isDue(NOW.minusSeconds(10), NOW);

        assertTrue(r.due());
        assertEquals(10.0, r.nextCheckSeconds(), 1e-9);
    }

    @Test
    void longOverdue_stillWaitsFullPeriodAfterFiring() {
        var expr = new IntervalExpression(Duration.ofMinutes(1));

        DueCheck r = expr.isDue(NOW.minus(Duration.ofHours(5)), NOW);

        assertTrue(r.due());
        assertEquals(60.0, r.nextCheckSeconds(), 1e-9);
    }

    @Test
    void microsecondPeriod_keepsSubSecondPrecision() {
        var expr = new IntervalExpression(IntervalUnit.MICROSECONDS.toDuration(500));

        DueCheck r = expr.isDue(NOW.minusNanos(100_000), NOW);

        assertFalse(r.due());
        assertEquals(0.0004, r.nextCheckSeconds(), 1e-9);
        assertEquals(Duration.ofNanos(400_000), r.nextCheck());
    }

    @Test
    void assumedLastFire_isOnePeriodAgo() {
        var expr = new IntervalExpression(Duration.ofSeconds(30));

        assertEquals(NOW.minusSeconds(30), expr.assumedLastFired(NOW));
        assertTrue(expr.isDue(expr.assumedLastFired(NOW), NOW).due());
    }

    @Test
    void periodLongerThanTimeline_assumesInstantMin_andIsNotDue() {
        var expr = new IntervalExpression(Duration.ofSeconds(Long.MAX_VALUE));

        Instant last = expr.assumedLastFired(NOW);
        DueCheck r = expr.isDue(last, NOW);

        assertEquals(Instant.MIN, last);
        assertFalse(r.due());
        assertTrue(r.nextCheckSeconds() > 1e15);
    }

    @Test
    void nonPositivePeriod_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalExpression(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new IntervalExpression(Duration.ofSeconds(-1)));
    }
}
