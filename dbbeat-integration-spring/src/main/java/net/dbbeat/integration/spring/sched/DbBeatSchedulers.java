package net.dbbeat.integration.spring.sched;

import net.dbbeat.core.maintenance.MaintenanceService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/** 스프링 @Scheduled 로 도는 주변 작업 (run record 보관 기간 정리). */
public class DbBeatSchedulers {
    private final MaintenanceService maintenance;

    private boolean retentionEnabled = true;
    private Duration recordTtl = Duration.ofDays(7);

    public DbBeatSchedulers(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${dbbeat.retention.run-every-ms:3600000}",
               initialDelayString = "${dbbeat.retention.initial-delay-ms:60000}")
    public void retention() throws Exception {
        if (!retentionEnabled) return;
        maintenance.runOnce(recordTtl);
    }

    public void setRetentionEnabled(boolean retentionEnabled) {
        this.retentionEnabled = retentionEnabled;
    }

    public void setRecordTtl(Duration recordTtl) {
        this.recordTtl = recordTtl;
    }
}
