package net.dbbeat.core.model;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

public enum IntervalUnit {
    DAYS(ChronoUnit.DAYS),
    HOURS(ChronoUnit.HOURS),
    MINUTES(ChronoUnit.MINUTES),
    SECONDS(ChronoUnit.SECONDS),
    MICROSECONDS(ChronoUnit.MICROS);

    private final ChronoUnit chronoUnit;

    IntervalUnit(ChronoUnit chronoUnit) {
        this.chronoUnit = chronoUnit;
    }

    public Duration toDuration(long every) {
        return Duration.of(every, chronoUnit);
    }

    /** DB code: days/hours/minutes/seconds/microseconds */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** @throws IllegalArgumentException for unknown codes */
    public static IntervalUnit from(String code) {
        if (code == null) throw new IllegalArgumentException("interval unit is required");
        try {
            return IntervalUnit.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown interval unit: " + code);
        }
    }
}
