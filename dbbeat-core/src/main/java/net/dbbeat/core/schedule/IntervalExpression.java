package net.dbbeat.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** "every N units": due once the full period elapsed since the last fire. */
public record IntervalExpression(Duration period) implements ScheduleExpression {

    public IntervalExpression {
        Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("interval period must be positive: " + period);
        }
    }

    @Override
    public DueCheck isDue(Instant lastFiredAt, Instant now) {
        Duration remaining = period.minus(Duration.between(lastFiredAt, now));
        if (remaining.isZero() || remaining.isNegative()) {
            // 발화 후에는 다음 주기 전체를 기다린다
            return DueCheck.due(DueCheck.seconds(period));
        }
        return DueCheck.notDue(DueCheck.seconds(remaining));
    }

    @Override
    public Instant assumedLastFired(Instant now) {
        // 표현 가능한 범위를 넘는 주기는 Instant.MIN 으로 고정
        Duration sinceMin = Duration.between(Instant.MIN, now);
        return period.compareTo(sinceMin) >= 0 ? Instant.MIN : now.minus(period);
    }
}
