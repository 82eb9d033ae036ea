package net.dbbeat.core.spi;

import net.dbbeat.core.model.PeriodicJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PeriodicJobRepository {
    /** ENABLED = 'Y' rows with interval/crontab resolved, in ID order */
    List<PeriodicJob> findAllEnabled() throws Exception;

    /** Writes only LAST_FIRED_AT/TOTAL_FIRE_COUNT. @return false when the job no longer exists */
    boolean saveRunStats(String name, Instant lastFiredAt, long totalFireCount) throws Exception;

    Optional<PeriodicJob> findById(long id) throws Exception;
    Optional<PeriodicJob> findByName(String name) throws Exception;

    /** @param enabled null = no filter */
    List<PeriodicJob> findAll(Boolean enabled, int limit, int offset) throws Exception;
    long count(Boolean enabled) throws Exception;

    PeriodicJob insert(PeriodicJob job) throws Exception;
    void update(PeriodicJob job) throws Exception;
    boolean delete(long id) throws Exception;
}
