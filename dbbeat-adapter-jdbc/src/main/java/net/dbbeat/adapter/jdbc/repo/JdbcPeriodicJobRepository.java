package net.dbbeat.adapter.jdbc.repo;

import net.dbbeat.adapter.jdbc.JsonColumns;
import net.dbbeat.adapter.jdbc.mapper.RowMappers;
import net.dbbeat.core.model.PeriodicJob;
import net.dbbeat.core.spi.PeriodicJobRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.dbbeat.adapter.jdbc.JdbcUtil.*;

public final class JdbcPeriodicJobRepository implements PeriodicJobRepository {

    // 스케줄은 LEFT JOIN 으로 한 번에 읽는다 (스케줄이 삭제된 job 도 로드됨)
    private static final String SELECT_JOB = """
            SELECT  j.ID, j.NAME, j.TARGET, j.INTERVAL_ID, j.CRONTAB_ID,
                    j.ARGS_JSON, j.KWARGS_JSON, j.QUEUE_NAME, j.PRIORITY,
                    j.EXPIRES_AT, j.EXPIRE_SECONDS, j.ONE_OFF, j.START_TIME, j.ENABLED,
                    j.LAST_FIRED_AT, j.TOTAL_FIRE_COUNT, j.DESCRIPTION, j.CREATED_AT, j.UPDATED_AT,
                    i.EVERY_COUNT, i.PERIOD_UNIT,
                    c.CRON_MINUTE, c.CRON_HOUR, c.CRON_DAY_OF_MONTH, c.CRON_MONTH, c.CRON_DAY_OF_WEEK, c.ZONE_ID
            FROM    TB_PERIODIC_JOB j
            LEFT JOIN TB_INTERVAL_SCHEDULE i ON i.ID = j.INTERVAL_ID
            LEFT JOIN TB_CRONTAB_SCHEDULE  c ON c.ID = j.CRONTAB_ID
            """;

    private final JsonColumns json;

    public JdbcPeriodicJobRepository(JsonColumns json) { this.json = json; }

    @Override
    public List<PeriodicJob> findAllEnabled() throws Exception {
        try (PreparedStatement ps = conn().prepareStatement(SELECT_JOB + " WHERE j.ENABLED = 'Y' ORDER BY j.ID")) {
            return list(ps);
        }
    }

    @Override
    public boolean saveRunStats(String name, Instant lastFiredAt, long totalFireCount) throws Exception {
        // 실행 통계만 갱신. UPDATED_AT / change marker 는 건드리지 않는다
        try (PreparedStatement ps = conn().prepareStatement("""
                UPDATE TB_PERIODIC_JOB
                   SET LAST_FIRED_AT = ?, TOTAL_FIRE_COUNT = ?
                 WHERE NAME = ?
            """)) {
            ps.setTimestamp(1, ts(lastFiredAt));
            ps.setLong(2, totalFireCount);
            ps.setString(3, name);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public Optional<PeriodicJob> findById(long id) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement(SELECT_JOB + " WHERE j.ID = ?")) {
            ps.setLong(1, id);
            return single(ps);
        }
    }

    @Override
    public Optional<PeriodicJob> findByName(String name) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement(SELECT_JOB + " WHERE j.NAME = ?")) {
            ps.setString(1, name);
            return single(ps);
        }
    }

    @Override
    public List<PeriodicJob> findAll(Boolean enabled, int limit, int offset) throws Exception {
        String where = enabled == null ? "" : " WHERE j.ENABLED = ?";
        try (PreparedStatement ps = conn().prepareStatement(
                SELECT_JOB + where + " ORDER BY j.ID OFFSET ? ROWS FETCH NEXT ? ROWS ONLY")) {
            int i = 1;
            if (enabled != null) ps.setString(i++, yn(enabled));
            ps.setInt(i++, offset);
            ps.setInt(i, limit);
            return list(ps);
        }
    }

    @Override
    public long count(Boolean enabled) throws Exception {
        String sql = "SELECT COUNT(*) FROM TB_PERIODIC_JOB" + (enabled == null ? "" : " WHERE ENABLED = ?");
        try (PreparedStatement ps = conn().prepareStatement(sql)) {
            if (enabled != null) ps.setString(1, yn(enabled));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    @Override
    public PeriodicJob insert(PeriodicJob job) throws Exception {
        long id;
        try (PreparedStatement ps = conn().prepareStatement("""
                INSERT INTO TB_PERIODIC_JOB
                    (NAME, TARGET, INTERVAL_ID, CRONTAB_ID, ARGS_JSON, KWARGS_JSON, QUEUE_NAME, PRIORITY,
                     EXPIRES_AT, EXPIRE_SECONDS, ONE_OFF, START_TIME, ENABLED,
                     LAST_FIRED_AT, TOTAL_FIRE_COUNT, DESCRIPTION, CREATED_AT, UPDATED_AT)
                VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            """, new String[]{"ID"})) {
            int i = bindDefinition(ps, job);
            ps.setTimestamp(i++, ts(job.lastFiredAt()));
            ps.setLong(i++, job.totalFireCount());
            ps.setString(i++, job.description());
            ps.setTimestamp(i++, ts(job.createdAt()));
            ps.setTimestamp(i, ts(job.updatedAt()));
            ps.executeUpdate();
            id = generatedId(ps);
        }
        return findById(id).orElseThrow(() -> new IllegalStateException("inserted job not found: " + job.name()));
    }

    @Override
    public void update(PeriodicJob job) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement("""
                UPDATE TB_PERIODIC_JOB
                   SET NAME = ?, TARGET = ?, INTERVAL_ID = ?, CRONTAB_ID = ?,
                       ARGS_JSON = ?, KWARGS_JSON = ?, QUEUE_NAME = ?, PRIORITY = ?,
                       EXPIRES_AT = ?, EXPIRE_SECONDS = ?, ONE_OFF = ?, START_TIME = ?, ENABLED = ?,
                       LAST_FIRED_AT = ?, TOTAL_FIRE_COUNT = ?, DESCRIPTION = ?, UPDATED_AT = ?
                 WHERE ID = ?
            """)) {
            int i = bindDefinition(ps, job);
            ps.setTimestamp(i++, ts(job.lastFiredAt()));
            ps.setLong(i++, job.totalFireCount());
            ps.setString(i++, job.description());
            ps.setTimestamp(i++, ts(job.updatedAt()));
            ps.setLong(i, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_PERIODIC_JOB not found for ID=" + job.id());
            }
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement("DELETE FROM TB_PERIODIC_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    /** NAME..ENABLED 13개 컬럼 바인딩, 다음 인덱스 반환 */
    private int bindDefinition(PreparedStatement ps, PeriodicJob job) throws SQLException {
        int i = 1;
        ps.setString(i++, job.name());
        ps.setString(i++, job.target());
        setNullableLong(ps, i++, job.intervalId());
        setNullableLong(ps, i++, job.crontabId());
        ps.setString(i++, json.write(job.args()));
        ps.setString(i++, json.write(job.kwargs()));
        ps.setString(i++, job.queue());
        setNullableInt(ps, i++, job.priority());
        ps.setTimestamp(i++, ts(job.expires()));
        setNullableInt(ps, i++, job.expireSeconds());
        ps.setString(i++, yn(job.oneOff()));
        ps.setTimestamp(i++, ts(job.startTime()));
        ps.setString(i++, yn(job.enabled()));
        return i;
    }

    private List<PeriodicJob> list(PreparedStatement ps) throws SQLException {
        List<PeriodicJob> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toPeriodicJob(rs, json));
        }
        return out;
    }

    private Optional<PeriodicJob> single(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toPeriodicJob(rs, json));
        }
    }
}
