package net.dbbeat.core.maintenance;

import net.dbbeat.core.service.RunRecordService;
import net.dbbeat.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final RunRecordService runRecords;
    private final Clock clock;

    public MaintenanceService(RunRecordService runRecords, Clock clock) {
        this.runRecords = runRecords;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 보관 기간(recordTtl)이 지난 run record 삭제
     * recordTtl 이 null/0/음수면 아무것도 지우지 않는다.
     */
    public MaintenanceReport runOnce(Duration recordTtl) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        if (recordTtl != null && !recordTtl.isZero() && !recordTtl.isNegative()) {
            r.threshold = now.minus(recordTtl);
            r.purgedRunRecords = runRecords.cleanupOlderThan(recordTtl);
        }

        r.timestamp = now;
        if (r.purgedRunRecords > 0) {
            log.info("maintenance: purged {} run record(s) created before {}", r.purgedRunRecords, r.threshold);
        } else {
            log.debug("maintenance: nothing to purge");
        }
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public Instant threshold;
        public int purgedRunRecords;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", threshold=" + threshold +
                    ", purgedRunRecords=" + purgedRunRecords +
                    '}';
        }
    }
}
