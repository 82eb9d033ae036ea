package net.dbbeat.bootstrap.autoconfigure;

import net.dbbeat.adapter.jdbc.JsonColumns;
import net.dbbeat.bootstrap.catalog.CatalogRegistrar;
import net.dbbeat.bootstrap.dispatch.LoggingTaskDispatcher;
import net.dbbeat.bootstrap.dispatch.RunRecordingTaskDispatcher;
import net.dbbeat.bootstrap.props.DbBeatProperties;
import net.dbbeat.core.maintenance.MaintenanceService;
import net.dbbeat.core.schedule.ScheduleResolver;
import net.dbbeat.core.service.*;
import net.dbbeat.core.spi.*;
import net.dbbeat.integration.spring.DbBeatSpringConfig;
import net.dbbeat.integration.spring.sched.BeatLifecycle;
import net.dbbeat.integration.spring.sched.DbBeatSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;
import java.util.stream.Collectors;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"})
@EnableConfigurationProperties(DbBeatProperties.class)
@Import(DbBeatSpringConfig.class) // integration-spring: repos/tx/clock/cron wiring
public class DbBeatAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DbBeatAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(TaskDispatcher.class)
    public TaskDispatcher loggingTaskDispatcher() {
        return new LoggingTaskDispatcher();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ScheduleResolver scheduleResolver(CronCalculator cron, DbBeatProperties props) {
        return new ScheduleResolver(cron, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RunRecordService runRecordService(RunRecordRepository runs,
                                             PeriodicJobRepository jobs,
                                             TxRunner tx,
                                             Clock clock) {
        return new RunRecordService(runs, jobs, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PeriodicJobAdminService periodicJobAdminService(PeriodicJobRepository jobs,
                                                           IntervalScheduleRepository intervals,
                                                           CrontabScheduleRepository crontabs,
                                                           ChangeMarkerRepository marker,
                                                           TaskDispatcher dispatcher,
                                                           RunRecordService runRecords,
                                                           JsonColumns json,
                                                           TxRunner tx,
                                                           Clock clock,
                                                           ScheduleResolver resolver,
                                                           DbBeatProperties props) {
        return new PeriodicJobAdminService(jobs, intervals, crontabs, marker,
                effectiveDispatcher(dispatcher, runRecords, json, props), tx, clock, resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public BeatScheduler beatScheduler(PeriodicJobRepository jobs,
                                       ChangeMarkerRepository markers,
                                       TaskDispatcher dispatcher,
                                       RunRecordService runRecords,
                                       JsonColumns json,
                                       TxRunner tx,
                                       Clock clock,
                                       ScheduleResolver resolver,
                                       DbBeatProperties props) {
        var s = props.getScheduler();
        var settings = new BeatSettings(s.getMaxInterval(), s.getSyncEvery(), s.getChangeCheckInterval());
        return new BeatScheduler(jobs, markers, effectiveDispatcher(dispatcher, runRecords, json, props),
                tx, clock, resolver, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(RunRecordService runRecords, Clock clock) {
        return new MaintenanceService(runRecords, clock);
    }

    // --- 스케줄러 스레드 / 주기 작업 (프로퍼티로 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "dbbeat.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BeatLifecycle beatLifecycle(BeatScheduler scheduler, DbBeatProperties props) {
        var l = new BeatLifecycle(scheduler);
        l.setShutdownTimeout(props.getScheduler().getShutdownTimeout());
        return l;
    }

    @Bean
    @ConditionalOnProperty(prefix = "dbbeat.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
    public DbBeatSchedulers dbBeatSchedulers(MaintenanceService maintenance, DbBeatProperties props) {
        var s = new DbBeatSchedulers(maintenance);
        // 실행 주기는 @Scheduled 가 dbbeat.retention.run-every-ms 에서 직접 읽음. 나머지만 세터로
        s.setRetentionEnabled(props.getRetention().isEnabled());
        s.setRecordTtl(props.getRetention().getKeep());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(PeriodicJobAdminService admin) {
        return new CatalogRegistrar(admin);
    }

    @Bean
    @ConditionalOnProperty(prefix = "dbbeat.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar,
                                           DbBeatProperties props) {
        if (log.isDebugEnabled()) {
            log.debug("catalog: \n{}", props.getCatalog().getJobs().stream()
                    .map(DbBeatProperties.JobDef::toString).collect(Collectors.joining("\n")));
        }
        return args -> registrar.register(props.getCatalog());
    }

    private static TaskDispatcher effectiveDispatcher(TaskDispatcher base,
                                                      RunRecordService runRecords,
                                                      JsonColumns json,
                                                      DbBeatProperties props) {
        return props.getRunRecords().isRecordSubmissions()
                ? new RunRecordingTaskDispatcher(base, runRecords, json)
                : base;
    }
}
