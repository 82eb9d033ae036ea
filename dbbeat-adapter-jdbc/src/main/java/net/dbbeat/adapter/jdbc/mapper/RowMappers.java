package net.dbbeat.adapter.jdbc.mapper;

import net.dbbeat.adapter.jdbc.JdbcUtil;
import net.dbbeat.adapter.jdbc.JsonColumns;
import net.dbbeat.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;

public final class RowMappers {
    private static final Logger log = LoggerFactory.getLogger(RowMappers.class);

    private RowMappers() {}

    // --- IntervalSchedule ---
    public static IntervalSchedule toInterval(ResultSet rs) throws SQLException {
        return new IntervalSchedule(
                rs.getLong("ID"),
                rs.getLong("EVERY_COUNT"),
                IntervalUnit.from(rs.getString("PERIOD_UNIT"))
        );
    }

    // --- CrontabSchedule ---
    public static CrontabSchedule toCrontab(ResultSet rs) throws SQLException {
        return new CrontabSchedule(
                rs.getLong("ID"),
                rs.getString("CRON_MINUTE"),
                rs.getString("CRON_HOUR"),
                rs.getString("CRON_DAY_OF_MONTH"),
                rs.getString("CRON_MONTH"),
                rs.getString("CRON_DAY_OF_WEEK"),
                rs.getString("ZONE_ID")
        );
    }

    // --- PeriodicJob (LEFT JOIN 된 스케줄 컬럼 포함) ---
    public static PeriodicJob toPeriodicJob(ResultSet rs, JsonColumns json) throws SQLException {
        String name = rs.getString("NAME");
        return new PeriodicJob(
                rs.getLong("ID"),
                name,
                rs.getString("TARGET"),
                joinedInterval(rs, name),
                joinedCrontab(rs),
                json.readList(rs.getString("ARGS_JSON")),
                json.readMap(rs.getString("KWARGS_JSON")),
                rs.getString("QUEUE_NAME"),
                JdbcUtil.getNullableInt(rs, "PRIORITY"),
                JdbcUtil.toInstant(rs.getTimestamp("EXPIRES_AT")),
                JdbcUtil.getNullableInt(rs, "EXPIRE_SECONDS"),
                JdbcUtil.isY(rs.getString("ONE_OFF")),
                JdbcUtil.toInstant(rs.getTimestamp("START_TIME")),
                JdbcUtil.isY(rs.getString("ENABLED")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_FIRED_AT")),
                rs.getLong("TOTAL_FIRE_COUNT"),
                rs.getString("DESCRIPTION"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    /** 잘못된 interval 행은 스케줄 없음으로 읽는다 (스케줄러가 그 job 만 건너뜀) */
    private static IntervalSchedule joinedInterval(ResultSet rs, String jobName) throws SQLException {
        Long id = JdbcUtil.getNullableLong(rs, "INTERVAL_ID");
        if (id == null) return null;
        try {
            return new IntervalSchedule(id, rs.getLong("EVERY_COUNT"), IntervalUnit.from(rs.getString("PERIOD_UNIT")));
        } catch (IllegalArgumentException e) {
            log.warn("job '{}' references an invalid interval schedule (id={}): {}", jobName, id, e.getMessage());
            return null;
        }
    }

    private static CrontabSchedule joinedCrontab(ResultSet rs) throws SQLException {
        Long id = JdbcUtil.getNullableLong(rs, "CRONTAB_ID");
        if (id == null) return null;
        return new CrontabSchedule(
                id,
                rs.getString("CRON_MINUTE"),
                rs.getString("CRON_HOUR"),
                rs.getString("CRON_DAY_OF_MONTH"),
                rs.getString("CRON_MONTH"),
                rs.getString("CRON_DAY_OF_WEEK"),
                rs.getString("ZONE_ID")
        );
    }

    // --- RunRecord ---
    public static RunRecord toRunRecord(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getLong("ID"),
                rs.getString("INVOCATION_ID"),
                rs.getString("JOB_NAME"),
                RunStatus.from(rs.getString("STATUS")),
                rs.getString("ARGS_JSON"),
                rs.getString("KWARGS_JSON"),
                rs.getString("RESULT_TEXT"),
                rs.getString("TRACEBACK"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT")),
                rs.getString("WORKER")
        );
    }
}
