package net.dbbeat.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PeriodicJob(
        Long id,
        String name,
        String target,               // 실행 대상 식별자 (큐에 넘기는 task 이름)
        IntervalSchedule interval,   // interval / crontab 중 정확히 하나
        CrontabSchedule crontab,
        List<Object> args,
        Map<String, Object> kwargs,
        String queue,
        Integer priority,            // 0..9
        Instant expires,
        Integer expireSeconds,
        boolean oneOff,
        Instant startTime,
        boolean enabled,
        Instant lastFiredAt,
        long totalFireCount,
        String description,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 9;

    public PeriodicJob {
        // JSON null 값을 허용해야 하므로 List.copyOf/Map.copyOf 대신 감싼다
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public Long intervalId() {
        return interval == null ? null : interval.id();
    }

    public Long crontabId() {
        return crontab == null ? null : crontab.id();
    }

    public boolean hasSingleSchedule() {
        return (interval == null) != (crontab == null);
    }

    public PeriodicJob withRunStats(Instant lastFiredAt, long totalFireCount) {
        return new PeriodicJob(id, name, target, interval, crontab, args, kwargs, queue, priority,
                expires, expireSeconds, oneOff, startTime, enabled, lastFiredAt, totalFireCount,
                description, createdAt, updatedAt);
    }

    public PeriodicJob withSchedule(IntervalSchedule interval, CrontabSchedule crontab) {
        return new PeriodicJob(id, name, target, interval, crontab, args, kwargs, queue, priority,
                expires, expireSeconds, oneOff, startTime, enabled, lastFiredAt, totalFireCount,
                description, createdAt, updatedAt);
    }

    public PeriodicJob withEnabled(boolean enabled) {
        return new PeriodicJob(id, name, target, interval, crontab, args, kwargs, queue, priority,
                expires, expireSeconds, oneOff, startTime, enabled, lastFiredAt, totalFireCount,
                description, createdAt, updatedAt);
    }

    public PeriodicJob withIdentity(Long id, Instant createdAt, Instant updatedAt) {
        return new PeriodicJob(id, name, target, interval, crontab, args, kwargs, queue, priority,
                expires, expireSeconds, oneOff, startTime, enabled, lastFiredAt, totalFireCount,
                description, createdAt, updatedAt);
    }

    /** Absolute {@code expires} wins over the relative {@code expireSeconds}. */
    public DispatchOptions dispatchOptions(Instant now) {
        Instant exp = expires;
        if (exp == null && expireSeconds != null) exp = now.plusSeconds(expireSeconds);
        return new DispatchOptions(queue, priority, exp);
    }

    public String scheduleDisplay() {
        if (interval != null) return "interval: " + interval;
        if (crontab != null) return "crontab: " + crontab;
        return "no schedule";
    }
}
