package net.dbbeat.app;

import net.dbbeat.core.model.NewPeriodicJob;
import net.dbbeat.core.service.PeriodicJobAdminService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/** 실제 Oracle XE 컨테이너 위의 전체 흐름. mvn -Pit verify */
@SpringBootTest(properties = {
        "dbbeat.scheduler.max-interval=PT0.5S",
        "dbbeat.scheduler.sync-every=PT0.5S",
        "dbbeat.scheduler.change-check-interval=PT0.5S",
        "dbbeat.retention.enabled=false",
        "dbbeat.catalog.enabled=false",
})
@Testcontainers
class SchedulingFlowIT {

    @Container
    static OracleContainer oracle = new OracleContainer(DockerImageName.parse("gvenzl/oracle-xe:21-slim"))
            .withStartupTimeout(Duration.ofMinutes(5));

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        // Boot DataSource & Flyway가 Testcontainers DB로 붙도록
        r.add("spring.datasource.url", oracle::getJdbcUrl);
        r.add("spring.datasource.username", oracle::getUsername);
        r.add("spring.datasource.password", oracle::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "oracle.jdbc.OracleDriver");
    }

    @TestConfiguration
    static class Dispatcher {
        @Bean
        RecordingTaskDispatcher recordingTaskDispatcher() {
            return new RecordingTaskDispatcher();
        }
    }

    @Autowired RecordingTaskDispatcher dispatcher;
    @Autowired PeriodicJobAdminService admin;
    @Autowired JdbcTemplate jdbc;

    @Test
    void intervalJob_firesAndPersistsStats_onOracle() throws Exception {
        long every1s = admin.createInterval(1, "seconds").id();
        admin.createJob(NewPeriodicJob.interval("ora-heartbeat", "test.oracle", every1s));

        await().atMost(Duration.ofSeconds(30))
                .until(() -> dispatcher.countFor("test.oracle") >= 2);
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            Long count = jdbc.queryForObject(
                    "SELECT TOTAL_FIRE_COUNT FROM TB_PERIODIC_JOB WHERE NAME = 'ora-heartbeat'", Long.class);
            assertThat(count).isGreaterThanOrEqualTo(1L);
            Integer pending = jdbc.queryForObject(
                    "SELECT COUNT(*) FROM TB_RUN_RECORD WHERE JOB_NAME = 'test.oracle'", Integer.class);
            assertThat(pending).isPositive();
        });
    }
}
