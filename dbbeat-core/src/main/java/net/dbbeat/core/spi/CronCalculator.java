package net.dbbeat.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Minute-granularity cron arithmetic for five-field expressions
 * ({@code minute hour day-of-month month day-of-week}).
 */
public interface CronCalculator {

    /** Latest matching minute at or before {@code atOrBefore}. */
    Optional<Instant> lastMatch(Instant atOrBefore, String cronExpr, ZoneId zone);

    /** First matching minute strictly after {@code after}. */
    Optional<Instant> next(Instant after, String cronExpr, ZoneId zone);

    /** @throws IllegalArgumentException when the expression cannot be parsed */
    void validate(String cronExpr);
}
