package net.dbbeat.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * 저장소 테스트 공통 DB 준비.
 * - 기본: H2 in-memory (MODE=Oracle)
 * - ORACLE_JDBC_URL 환경변수가 있으면 그 Oracle 사용
 * - {@link #useOracleContainer()} 가 true 면 Testcontainers Oracle XE 기동 (*IT)
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected DataSource ds;
    protected OracleContainer oracle;
    protected JdbcTxRunner tx;

    protected boolean useOracleContainer() { return false; }

    @BeforeAll
    void setupDb() {
        String url = System.getenv("ORACLE_JDBC_URL");
        String user = System.getenv("ORACLE_USERNAME");
        String pass = System.getenv("ORACLE_PASSWORD");

        HikariConfig cfg = new HikariConfig();
        if (useOracleContainer() && (url == null || url.isBlank())) {
            // Testcontainers Oracle XE (gvenzl/oracle-xe)
            oracle = new OracleContainer(DockerImageName.parse("gvenzl/oracle-xe:21-slim"))
                    .withStartupTimeout(Duration.ofMinutes(5));
            oracle.start();

            url = oracle.getJdbcUrl();
            user = Optional.ofNullable(oracle.getUsername()).orElse("system");
            pass = Optional.ofNullable(oracle.getPassword()).orElse("oracle");
        }

        if (url != null && !url.isBlank()) {
            cfg.setJdbcUrl(url);
            cfg.setUsername(user);
            cfg.setPassword(pass);
            cfg.setDriverClassName("oracle.jdbc.OracleDriver");
        } else {
            // 테스트 클래스마다 독립 DB
            cfg.setJdbcUrl("jdbc:h2:mem:dbbeat-" + UUID.randomUUID() + ";MODE=Oracle;DB_CLOSE_DELAY=-1");
            cfg.setUsername("sa");
            cfg.setPassword("");
        }
        cfg.setMaximumPoolSize(6);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/dbbeat")
                .baselineOnMigrate(true)
                .load()
                .migrate();

        tx = new JdbcTxRunner(ds);
    }

    /** 매 테스트 격리용: FK 순서대로 DELETE, marker 는 고정값으로 */
    protected void cleanTables() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                for (String t : new String[]{"TB_RUN_RECORD", "TB_PERIODIC_JOB", "TB_INTERVAL_SCHEDULE", "TB_CRONTAB_SCHEDULE"}) {
                    st.execute("DELETE FROM " + t);
                }
                st.execute("UPDATE TB_PERIODIC_JOB_CHANGED SET LAST_UPDATE = TIMESTAMP '2000-01-01 00:00:00' WHERE ID = 1");
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
        if (oracle != null) oracle.stop();
    }
}
