package net.dbbeat.core.spi;

import net.dbbeat.core.model.IntervalSchedule;
import net.dbbeat.core.model.IntervalUnit;

import java.util.List;
import java.util.Optional;

public interface IntervalScheduleRepository {
    /** 멱등: (EVERY_COUNT, PERIOD_UNIT) 유니크 */
    IntervalSchedule getOrCreate(long every, IntervalUnit unit) throws Exception;
    Optional<IntervalSchedule> findById(long id) throws Exception;
    List<IntervalSchedule> findAll() throws Exception;
    boolean delete(long id) throws Exception;
}
