package net.dbbeat.adapter.jdbc;

import net.dbbeat.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/** 이 모듈 테스트는 interval job 만 쓴다 */
final class UnsupportedCron implements CronCalculator {
    @Override public Optional<Instant> lastMatch(Instant atOrBefore, String cronExpr, ZoneId zone) { throw new UnsupportedOperationException(); }
    @Override public Optional<Instant> next(Instant after, String cronExpr, ZoneId zone) { throw new UnsupportedOperationException(); }
    @Override public void validate(String cronExpr) { }
}
