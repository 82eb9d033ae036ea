package net.dbbeat.core.service;

import java.time.Duration;
import java.util.Objects;

/**
 * @param maxInterval          longest the loop sleeps between two ticks
 * @param syncEvery            how often dirty run statistics are flushed
 * @param changeCheckInterval  how often the change marker is polled
 */
public record BeatSettings(
        Duration maxInterval,
        Duration syncEvery,
        Duration changeCheckInterval
) {
    public BeatSettings {
        requirePositive(maxInterval, "maxInterval");
        requirePositive(syncEvery, "syncEvery");
        requirePositive(changeCheckInterval, "changeCheckInterval");
    }

    public static BeatSettings defaults() {
        return new BeatSettings(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive: " + d);
    }
}
