package net.dbbeat.core.model;

import java.time.Duration;

public record IntervalSchedule(
        Long id,
        long every,
        IntervalUnit unit
) {
    public IntervalSchedule {
        if (every <= 0) throw new IllegalArgumentException("every must be positive: " + every);
        if (unit == null) throw new IllegalArgumentException("unit is required");
    }

    /** @throws IllegalArgumentException when every x unit does not fit in a {@link Duration} */
    public Duration period() {
        try {
            return unit.toDuration(every);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("interval too large: every " + every + " " + unit.code(), e);
        }
    }

    @Override
    public String toString() {
        return "every " + every + " " + unit.code();
    }
}
