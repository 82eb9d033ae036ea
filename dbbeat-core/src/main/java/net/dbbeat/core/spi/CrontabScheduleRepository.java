package net.dbbeat.core.spi;

import net.dbbeat.core.model.CrontabSchedule;

import java.util.List;
import java.util.Optional;

public interface CrontabScheduleRepository {
    CrontabSchedule insert(CrontabSchedule crontab) throws Exception;
    Optional<CrontabSchedule> findById(long id) throws Exception;
    List<CrontabSchedule> findAll() throws Exception;
    boolean delete(long id) throws Exception;
}
