package net.dbbeat.core.model;

import java.time.Instant;

public record RunRecord(
        Long id,
        String invocationId,
        String jobName,
        RunStatus status,
        String argsJson,
        String kwargsJson,
        String result,
        String traceback,
        Instant createdAt,
        Instant completedAt,   // terminal 상태로 전이될 때만 세팅
        String worker
) {
    public RunRecord withState(RunStatus status, String result, String traceback, Instant completedAt) {
        return new RunRecord(id, invocationId, jobName, status, argsJson, kwargsJson,
                result, traceback, createdAt, completedAt, worker);
    }

    public RunRecord withWorker(String worker) {
        return new RunRecord(id, invocationId, jobName, status, argsJson, kwargsJson,
                result, traceback, createdAt, completedAt, worker);
    }

    public RunRecord withId(Long id) {
        return new RunRecord(id, invocationId, jobName, status, argsJson, kwargsJson,
                result, traceback, createdAt, completedAt, worker);
    }
}
