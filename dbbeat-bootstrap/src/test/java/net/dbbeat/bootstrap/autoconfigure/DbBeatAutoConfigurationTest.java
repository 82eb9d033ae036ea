package net.dbbeat.bootstrap.autoconfigure;

import net.dbbeat.bootstrap.catalog.CatalogRegistrar;
import net.dbbeat.bootstrap.dispatch.LoggingTaskDispatcher;
import net.dbbeat.core.maintenance.MaintenanceService;
import net.dbbeat.core.schedule.ScheduleResolver;
import net.dbbeat.core.service.BeatScheduler;
import net.dbbeat.core.service.PeriodicJobAdminService;
import net.dbbeat.core.spi.TaskDispatcher;
import net.dbbeat.integration.spring.sched.BeatLifecycle;
import net.dbbeat.integration.spring.sched.DbBeatSchedulers;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DbBeatAutoConfigurationTest {

    // 스케줄러 스레드는 띄우지 않고 조립만 확인
    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DbBeatAutoConfiguration.class))
            .withBean(DataSource.class, () -> mock(DataSource.class))
            .withBean(PlatformTransactionManager.class, () -> mock(PlatformTransactionManager.class))
            .withPropertyValues("dbbeat.scheduler.enabled=false", "dbbeat.catalog.enabled=false");

    @Test
    void wiresCoreServices() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(BeatScheduler.class);
            assertThat(ctx).hasSingleBean(PeriodicJobAdminService.class);
            assertThat(ctx).hasSingleBean(MaintenanceService.class);
            assertThat(ctx).hasSingleBean(CatalogRegistrar.class);
            assertThat(ctx).hasSingleBean(DbBeatSchedulers.class);
            assertThat(ctx).getBean(TaskDispatcher.class).isInstanceOf(LoggingTaskDispatcher.class);
            assertThat(ctx).doesNotHaveBean(BeatLifecycle.class);
        });
    }

    @Test
    void defaults_matchDocumentedValues() {
        runner.run(ctx -> {
            assertThat(ctx.getBean(ScheduleResolver.class).defaultZone()).isEqualTo(ZoneId.of("Asia/Shanghai"));
            var settings = ctx.getBean(BeatScheduler.class).settings();
            assertThat(settings.maxInterval()).isEqualTo(Duration.ofSeconds(5));
            assertThat(settings.syncEvery()).isEqualTo(Duration.ofSeconds(5));
            assertThat(settings.changeCheckInterval()).isEqualTo(Duration.ofSeconds(5));
        });
    }

    @Test
    void properties_overrideSettings() {
        runner.withPropertyValues("dbbeat.zone=UTC",
                        "dbbeat.scheduler.max-interval=PT2S",
                        "dbbeat.scheduler.change-check-interval=PT10S")
                .run(ctx -> {
                    assertThat(ctx.getBean(ScheduleResolver.class).defaultZone()).isEqualTo(ZoneId.of("UTC"));
                    var settings = ctx.getBean(BeatScheduler.class).settings();
                    assertThat(settings.maxInterval()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(settings.changeCheckInterval()).isEqualTo(Duration.ofSeconds(10));
                });
    }

    @Test
    void userDispatcher_replacesDefault() {
        TaskDispatcher custom = (target, args, kwargs, options) -> "custom";
        runner.withBean(TaskDispatcher.class, () -> custom)
                .run(ctx -> assertThat(ctx.getBean(TaskDispatcher.class)).isSameAs(custom));
    }

    @Test
    void retentionCanBeSwitchedOff() {
        runner.withPropertyValues("dbbeat.retention.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(DbBeatSchedulers.class));
    }
}
