package net.dbbeat.core.schedule;

import net.dbbeat.core.model.CrontabSchedule;
import net.dbbeat.core.spi.CronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Cron pattern evaluated against wall-clock time in the schedule's zone.
 *
 * <p>Two stages. First the raw cron due-ness: the latest matching minute at or
 * before {@code now} is later than the last fire. Then the trigger window:
 * the job only fires when {@code now} is at most {@link #TRIGGER_WINDOW} past
 * that minute. A slot that was passed by more than the window is skipped and
 * the next one is awaited, re-checking at least every
 * {@link #MAX_RECHECK_SECONDS} seconds.
 *
 * <p>An unknown timezone or an unparseable pattern never fires.
 */
public final class CrontabExpression implements ScheduleExpression {
    private static final Logger log = LoggerFactory.getLogger(CrontabExpression.class);

    public static final Duration TRIGGER_WINDOW = Duration.ofSeconds(1);
    public static final double MAX_RECHECK_SECONDS = 5.0;
    static final Duration ASSUMED_PERIOD = Duration.ofDays(1);

    private final String cronExpr;
    private final ZoneId zone;        // null = fail closed
    private final CronCalculator cron;

    private CrontabExpression(String cronExpr, ZoneId zone, CronCalculator cron) {
        this.cronExpr = cronExpr;
        this.zone = zone;
        this.cron = cron;
    }

    public static CrontabExpression of(CrontabSchedule crontab, CronCalculator cron, ZoneId defaultZone) {
        String expr = crontab.toCronExpression();
        ZoneId zone = resolveZone(crontab.timezone(), defaultZone);
        if (zone != null) {
            try {
                cron.validate(expr);
            } catch (IllegalArgumentException e) {
                log.warn("crontab '{}' (id={}) cannot be parsed, it will never fire: {}",
                        expr, crontab.id(), e.getMessage());
                zone = null;
            }
        }
        return new CrontabExpression(expr, zone, cron);
    }

    private static ZoneId resolveZone(String timezone, ZoneId defaultZone) {
        if (timezone == null || timezone.isBlank()) return defaultZone;
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("unknown timezone '{}', crontab will never fire", timezone);
            return null;
        }
    }

    public boolean evaluable() {
        return zone != null;
    }

    public String cronExpr() {
        return cronExpr;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public DueCheck isDue(Instant lastFiredAt, Instant now) {
        if (zone == null) return DueCheck.notDue(MAX_RECHECK_SECONDS);
        try {
            Optional<Instant> next = cron.next(now, cronExpr, zone);
            double untilNext = next
                    .map(n -> Math.min(DueCheck.seconds(Duration.between(now, n)), MAX_RECHECK_SECONDS))
                    .orElse(MAX_RECHECK_SECONDS);

            Optional<Instant> slot = cron.lastMatch(now, cronExpr, zone);
            if (slot.isEmpty() || !slot.get().isAfter(lastFiredAt)) {
                return DueCheck.notDue(untilNext);
            }
            // raw due. slot 경계에서 1초 이상 지났으면 다음 slot 까지 기다림
            if (Duration.between(slot.get(), now).compareTo(TRIGGER_WINDOW) > 0) {
                return DueCheck.notDue(untilNext);
            }
            return DueCheck.due(untilNext);
        } catch (RuntimeException e) {
            log.warn("crontab '{}' in {} could not be evaluated: {}", cronExpr, zone, e.toString());
            return DueCheck.notDue(MAX_RECHECK_SECONDS);
        }
    }

    @Override
    public Instant assumedLastFired(Instant now) {
        return now.minus(ASSUMED_PERIOD);
    }

    @Override
    public String toString() {
        return "CrontabExpression{" + cronExpr + " @ " + (zone == null ? "<invalid zone>" : zone) + '}';
    }
}
