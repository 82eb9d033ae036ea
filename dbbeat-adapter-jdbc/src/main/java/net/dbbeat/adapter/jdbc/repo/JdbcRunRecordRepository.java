package net.dbbeat.adapter.jdbc.repo;

import net.dbbeat.adapter.jdbc.mapper.RowMappers;
import net.dbbeat.core.model.RunRecord;
import net.dbbeat.core.model.RunStatus;
import net.dbbeat.core.spi.RunRecordRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static net.dbbeat.adapter.jdbc.JdbcUtil.*;

public final class JdbcRunRecordRepository implements RunRecordRepository {

    private static final String COLUMNS = """
            ID, INVOCATION_ID, JOB_NAME, STATUS, ARGS_JSON, KWARGS_JSON,
            RESULT_TEXT, TRACEBACK, CREATED_AT, COMPLETED_AT, WORKER
            """;

    @Override
    public Optional<RunRecord> findByInvocationId(String invocationId) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement(
                "SELECT " + COLUMNS + " FROM TB_RUN_RECORD WHERE INVOCATION_ID = ?")) {
            ps.setString(1, invocationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toRunRecord(rs));
            }
        }
    }

    @Override
    public RunRecord insert(RunRecord r) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement("""
                INSERT INTO TB_RUN_RECORD
                    (INVOCATION_ID, JOB_NAME, STATUS, ARGS_JSON, KWARGS_JSON,
                     RESULT_TEXT, TRACEBACK, CREATED_AT, COMPLETED_AT, WORKER)
                VALUES (?,?,?,?,?,?,?,?,?,?)
            """, new String[]{"ID"})) {
            ps.setString(1, r.invocationId());
            ps.setString(2, r.jobName());
            ps.setString(3, r.status().code());
            ps.setString(4, r.argsJson());
            ps.setString(5, r.kwargsJson());
            ps.setString(6, r.result());
            ps.setString(7, r.traceback());
            ps.setTimestamp(8, ts(r.createdAt()));
            ps.setTimestamp(9, ts(r.completedAt()));
            ps.setString(10, r.worker());
            ps.executeUpdate();
            return r.withId(generatedId(ps));
        }
    }

    @Override
    public void update(RunRecord r) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement("""
                UPDATE TB_RUN_RECORD
                   SET STATUS = ?, RESULT_TEXT = ?, TRACEBACK = ?, COMPLETED_AT = ?, WORKER = ?
                 WHERE INVOCATION_ID = ?
            """)) {
            ps.setString(1, r.status().code());
            ps.setString(2, r.result());
            ps.setString(3, r.traceback());
            ps.setTimestamp(4, ts(r.completedAt()));
            ps.setString(5, r.worker());
            ps.setString(6, r.invocationId());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_RUN_RECORD not found for INVOCATION_ID=" + r.invocationId());
            }
        }
    }

    @Override
    public List<RunRecord> find(String jobName, RunStatus status, int limit, int offset) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM TB_RUN_RECORD WHERE 1 = 1");
        if (jobName != null) sql.append(" AND JOB_NAME = ?");
        if (status != null) sql.append(" AND STATUS = ?");
        sql.append(" ORDER BY CREATED_AT DESC, ID DESC OFFSET ? ROWS FETCH NEXT ? ROWS ONLY");

        try (PreparedStatement ps = conn().prepareStatement(sql.toString())) {
            int i = 1;
            if (jobName != null) ps.setString(i++, jobName);
            if (status != null) ps.setString(i++, status.code());
            ps.setInt(i++, offset);
            ps.setInt(i, limit);
            List<RunRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toRunRecord(rs));
            }
            return out;
        }
    }

    @Override
    public int deleteCreatedBefore(Instant threshold) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement("DELETE FROM TB_RUN_RECORD WHERE CREATED_AT < ?")) {
            ps.setTimestamp(1, ts(threshold));
            return ps.executeUpdate();
        }
    }

    @Override
    public Map<RunStatus, Long> countByStatus() throws Exception {
        Map<RunStatus, Long> out = new EnumMap<>(RunStatus.class);
        try (PreparedStatement ps = conn().prepareStatement(
                "SELECT STATUS, COUNT(*) AS CNT FROM TB_RUN_RECORD GROUP BY STATUS");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.merge(RunStatus.from(rs.getString("STATUS")), rs.getLong("CNT"), Long::sum);
        }
        return out;
    }
}
