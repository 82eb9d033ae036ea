package net.dbbeat.integration.spring;

import net.dbbeat.adapter.jdbc.JsonColumns;
import net.dbbeat.adapter.jdbc.repo.*;
import net.dbbeat.core.spi.*;
import net.dbbeat.integration.spring.cron.CronUtilsCalculator;
import net.dbbeat.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class DbBeatSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean public JsonColumns jsonColumns() { return new JsonColumns(); }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public PeriodicJobRepository periodicJobRepository(JsonColumns json) { return new JdbcPeriodicJobRepository(json); }
    @Bean public IntervalScheduleRepository intervalScheduleRepository() { return new JdbcIntervalScheduleRepository(); }
    @Bean public CrontabScheduleRepository crontabScheduleRepository() { return new JdbcCrontabScheduleRepository(); }
    @Bean public ChangeMarkerRepository changeMarkerRepository() { return new JdbcChangeMarkerRepository(); }
    @Bean public RunRecordRepository runRecordRepository() { return new JdbcRunRecordRepository(); }

    @Bean public Clock systemClock() { return Instant::now; }

    @Bean public CronCalculator cronCalculator() { return new CronUtilsCalculator(); }
}
