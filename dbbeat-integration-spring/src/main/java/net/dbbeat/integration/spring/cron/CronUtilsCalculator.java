package net.dbbeat.integration.spring.cron;

import net.dbbeat.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/** 코어 SPI 구현체 */
public final class CronUtilsCalculator implements CronCalculator {

    @Override
    public Optional<Instant> lastMatch(Instant atOrBefore, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.slotAtOrBefore(cronExpr, zone, atOrBefore);
    }

    @Override
    public Optional<Instant> next(Instant after, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.nextAfter(cronExpr, zone, after);
    }

    @Override
    public void validate(String cronExpr) {
        CronSlotPlanner.executionTime(cronExpr);
    }
}
