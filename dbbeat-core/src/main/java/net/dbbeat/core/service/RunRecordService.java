package net.dbbeat.core.service;

import net.dbbeat.core.model.RunRecord;
import net.dbbeat.core.model.RunStatus;
import net.dbbeat.core.model.SchedulerStatistics;
import net.dbbeat.core.spi.Clock;
import net.dbbeat.core.spi.PeriodicJobRepository;
import net.dbbeat.core.spi.RunRecordRepository;
import net.dbbeat.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Bookkeeping of individual invocations, written by dispatch/worker-side hooks. */
public final class RunRecordService {
    private final RunRecordRepository runs;
    private final PeriodicJobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;

    public RunRecordService(RunRecordRepository runs, PeriodicJobRepository jobs, TxRunner tx, Clock clock) {
        this.runs = runs;
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Creates the record on first sight of {@code invocationId}, otherwise moves
     * it to {@code status}. {@code completedAt} is stamped when the status enters
     * SUCCESS/FAILURE/REVOKED, kept while it stays terminal, cleared otherwise.
     * Null {@code worker} keeps the stored one.
     */
    public RunRecord recordState(String invocationId,
                                 String jobName,
                                 RunStatus status,
                                 String argsJson,
                                 String kwargsJson,
                                 String result,
                                 String traceback,
                                 String worker) throws Exception {
        if (invocationId == null || invocationId.isBlank()) {
            throw new IllegalArgumentException("invocationId is required");
        }
        Objects.requireNonNull(status, "status");

        return tx.required(() -> {
            Instant now = clock.now();
            Optional<RunRecord> existing = runs.findByInvocationId(invocationId);
            if (existing.isEmpty()) {
                return runs.insert(new RunRecord(null, invocationId, jobName, status, argsJson, kwargsJson,
                        result, traceback, now, status.terminal() ? now : null, worker));
            }

            RunRecord current = existing.get();
            Instant completedAt;
            if (!status.terminal()) {
                completedAt = null;
            } else if (current.status().terminal() && current.completedAt() != null) {
                completedAt = current.completedAt();
            } else {
                completedAt = now;
            }
            RunRecord updated = current.withState(status, result, traceback, completedAt);
            if (worker != null) updated = updated.withWorker(worker);
            runs.update(updated);
            return updated;
        });
    }

    public Optional<RunRecord> find(String invocationId) throws Exception {
        return tx.required(() -> runs.findByInvocationId(invocationId));
    }

    /** Newest first. Null filters are ignored. */
    public List<RunRecord> list(String jobName, RunStatus status, int limit, int offset) throws Exception {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset must not be negative: " + offset);
        return tx.required(() -> runs.find(jobName, status, limit, offset));
    }

    /**
     * Deletes records created more than {@code keep} ago.
     * Null, zero or negative {@code keep} deletes nothing.
     */
    public int cleanupOlderThan(Duration keep) throws Exception {
        if (keep == null || keep.isZero() || keep.isNegative()) return 0;
        Instant threshold = clock.now().minus(keep);
        return tx.required(() -> runs.deleteCreatedBefore(threshold));
    }

    public SchedulerStatistics statistics() throws Exception {
        return tx.required(() -> {
            long total = jobs.count(null);
            long enabled = jobs.count(Boolean.TRUE);
            Map<RunStatus, Long> byStatus = runs.countByStatus();
            long runTotal = byStatus.values().stream().mapToLong(Long::longValue).sum();
            return new SchedulerStatistics(
                    total, enabled, total - enabled,
                    runTotal,
                    byStatus.getOrDefault(RunStatus.SUCCESS, 0L),
                    byStatus.getOrDefault(RunStatus.FAILURE, 0L),
                    byStatus.getOrDefault(RunStatus.PENDING, 0L));
        });
    }
}
