package net.dbbeat.core.spi;

import net.dbbeat.core.model.RunRecord;
import net.dbbeat.core.model.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface RunRecordRepository {
    Optional<RunRecord> findByInvocationId(String invocationId) throws Exception;
    RunRecord insert(RunRecord record) throws Exception;
    void update(RunRecord record) throws Exception;

    /** newest first; null filters are ignored */
    List<RunRecord> find(String jobName, RunStatus status, int limit, int offset) throws Exception;

    int deleteCreatedBefore(Instant threshold) throws Exception;
    Map<RunStatus, Long> countByStatus() throws Exception;
}
