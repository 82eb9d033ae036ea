package net.dbbeat.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Admin-side creation request; schedules are referenced by id. */
public record NewPeriodicJob(
        String name,
        String target,
        Long intervalId,
        Long crontabId,
        List<Object> args,
        Map<String, Object> kwargs,
        String queue,
        Integer priority,
        Instant expires,
        Integer expireSeconds,
        boolean oneOff,
        Instant startTime,
        boolean enabled,
        String description
) {
    public static NewPeriodicJob interval(String name, String target, long intervalId) {
        return new NewPeriodicJob(name, target, intervalId, null, List.of(), Map.of(),
                null, null, null, null, false, null, true, null);
    }

    public static NewPeriodicJob crontab(String name, String target, long crontabId) {
        return new NewPeriodicJob(name, target, null, crontabId, List.of(), Map.of(),
                null, null, null, null, false, null, true, null);
    }
}
