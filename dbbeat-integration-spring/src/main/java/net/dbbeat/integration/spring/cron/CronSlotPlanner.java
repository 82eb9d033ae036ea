package net.dbbeat.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * cron-utils 기반 슬롯 계산기 (UNIX 5-field, 분 단위).
 * 파싱 결과는 LRU 캐시 (Guava 없이)
 */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 간단 LRU(최대 256개). access-order LinkedHashMap 이라 조회도 동기화 필요
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /** @throws IllegalArgumentException when cron-utils rejects the expression */
    public static ExecutionTime executionTime(String cronExpr) {
        Objects.requireNonNull(cronExpr, "cronExpr");
        synchronized (CACHE) {
            ExecutionTime et = CACHE.get(cronExpr);
            if (et == null) {
                et = ExecutionTime.forCron(PARSER.parse(cronExpr));
                CACHE.put(cronExpr, et);
            }
            return et;
        }
    }

    /** 현재 분이 매칭되면 그 분, 아니면 직전 실행 시각 */
    public static Optional<Instant> slotAtOrBefore(String cronExpr, ZoneId zone, Instant at) {
        ExecutionTime et = executionTime(cronExpr);
        ZonedDateTime minute = at.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
        if (et.isMatch(minute)) return Optional.of(minute.toInstant());
        return et.lastExecution(minute).map(ZonedDateTime::toInstant);
    }

    public static Optional<Instant> nextAfter(String cronExpr, ZoneId zone, Instant after) {
        return executionTime(cronExpr).nextExecution(after.atZone(zone)).map(ZonedDateTime::toInstant);
    }

    public static void invalidate(String expr) { synchronized (CACHE) { CACHE.remove(expr); } }
    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    static int cachedCount() { synchronized (CACHE) { return CACHE.size(); } }

    // --- 내부 LRU ---
    private static final class LruMap<K,V> extends LinkedHashMap<K,V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K,V> eldest) { return size() > max; }
    }
}
