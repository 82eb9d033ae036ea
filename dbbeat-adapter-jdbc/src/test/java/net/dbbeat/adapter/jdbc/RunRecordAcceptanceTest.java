package net.dbbeat.adapter.jdbc;

import net.dbbeat.adapter.jdbc.repo.JdbcPeriodicJobRepository;
import net.dbbeat.adapter.jdbc.repo.JdbcRunRecordRepository;
import net.dbbeat.core.maintenance.MaintenanceService;
import net.dbbeat.core.model.RunRecord;
import net.dbbeat.core.model.RunStatus;
import net.dbbeat.core.service.RunRecordService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RunRecordAcceptanceTest extends TestSupport {

    final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-03-01T10:00:00Z"));

    RunRecordService service;

    @BeforeAll
    void initAll() {
        service = new RunRecordService(new JdbcRunRecordRepository(),
                new JdbcPeriodicJobRepository(new JsonColumns()), tx, now::get);
    }

    @BeforeEach
    void clean() throws Exception {
        cleanTables();
    }

    private void advance(Duration d) {
        now.updateAndGet(t -> t.plus(d));
    }

    @Test
    void stateTransitions_persistCompletedAtInvariant() throws Exception {
        service.recordState("inv-1", "noop", RunStatus.PENDING, "[1]", "{\"a\":1}", null, null, null);
        advance(Duration.ofSeconds(1));
        service.recordState("inv-1", "noop", RunStatus.STARTED, null, null, null, null, "worker-1@host");
        assertNull(service.find("inv-1").orElseThrow().completedAt());

        advance(Duration.ofSeconds(2));
        Instant done = now.get();
        service.recordState("inv-1", "noop", RunStatus.SUCCESS, null, null, "ok", null, null);

        RunRecord r = service.find("inv-1").orElseThrow();
        assertEquals(RunStatus.SUCCESS, r.status());
        assertEquals(done, r.completedAt());
        assertEquals("ok", r.result());
        assertEquals("worker-1@host", r.worker());
        assertEquals("[1]", r.argsJson());
        assertEquals("{\"a\":1}", r.kwargsJson());

        advance(Duration.ofSeconds(1));
        service.recordState("inv-1", "noop", RunStatus.RETRY, null, null, null, "Traceback...", null);
        assertNull(service.find("inv-1").orElseThrow().completedAt());
    }

    @Test
    void list_newestFirst_andStatistics() throws Exception {
        service.recordState("a", "noop", RunStatus.SUCCESS, null, null, null, null, null);
        advance(Duration.ofSeconds(1));
        service.recordState("b", "noop", RunStatus.FAILURE, null, null, null, "boom", null);
        advance(Duration.ofSeconds(1));
        service.recordState("c", "other", RunStatus.PENDING, null, null, null, null, null);

        assertEquals(List.of("c", "b", "a"),
                service.list(null, null, 10, 0).stream().map(RunRecord::invocationId).toList());
        assertEquals(List.of("b"),
                service.list("noop", RunStatus.FAILURE, 10, 0).stream().map(RunRecord::invocationId).toList());

        var stats = service.statistics();
        assertEquals(3, stats.totalRuns());
        assertEquals(1, stats.successRuns());
        assertEquals(1, stats.failureRuns());
        assertEquals(1, stats.pendingRuns());
        assertEquals(0, stats.totalJobs());
    }

    @Test
    void maintenance_purgesOnlyExpiredRecords() throws Exception {
        service.recordState("old", "noop", RunStatus.SUCCESS, null, null, null, null, null);
        advance(Duration.ofDays(8));
        service.recordState("fresh", "noop", RunStatus.SUCCESS, null, null, null, null, null);

        var report = new MaintenanceService(service, now::get).runOnce(Duration.ofDays(7));

        assertEquals(1, report.purgedRunRecords);
        assertTrue(service.find("old").isEmpty());
        assertTrue(service.find("fresh").isPresent());
    }
}
