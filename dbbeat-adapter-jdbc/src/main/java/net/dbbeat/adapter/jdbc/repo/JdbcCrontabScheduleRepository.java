package net.dbbeat.adapter.jdbc.repo;

import net.dbbeat.adapter.jdbc.mapper.RowMappers;
import net.dbbeat.core.model.CrontabSchedule;
import net.dbbeat.core.spi.CrontabScheduleRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.dbbeat.adapter.jdbc.JdbcUtil.*;

public final class JdbcCrontabScheduleRepository implements CrontabScheduleRepository {

    private static final String COLUMNS =
            "ID, CRON_MINUTE, CRON_HOUR, CRON_DAY_OF_MONTH, CRON_MONTH, CRON_DAY_OF_WEEK, ZONE_ID";

    @Override
    public CrontabSchedule insert(CrontabSchedule c) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement("""
                INSERT INTO TB_CRONTAB_SCHEDULE
                    (CRON_MINUTE, CRON_HOUR, CRON_DAY_OF_MONTH, CRON_MONTH, CRON_DAY_OF_WEEK, ZONE_ID)
                VALUES (?,?,?,?,?,?)
            """, new String[]{"ID"})) {
            ps.setString(1, c.minute());
            ps.setString(2, c.hour());
            ps.setString(3, c.dayOfMonth());
            ps.setString(4, c.monthOfYear());
            ps.setString(5, c.dayOfWeek());
            ps.setString(6, c.timezone());
            ps.executeUpdate();
            return new CrontabSchedule(generatedId(ps), c.minute(), c.hour(), c.dayOfMonth(),
                    c.monthOfYear(), c.dayOfWeek(), c.timezone());
        }
    }

    @Override
    public Optional<CrontabSchedule> findById(long id) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement(
                "SELECT " + COLUMNS + " FROM TB_CRONTAB_SCHEDULE WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toCrontab(rs));
            }
        }
    }

    @Override
    public List<CrontabSchedule> findAll() throws Exception {
        List<CrontabSchedule> out = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(
                "SELECT " + COLUMNS + " FROM TB_CRONTAB_SCHEDULE ORDER BY ID");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toCrontab(rs));
        }
        return out;
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement("DELETE FROM TB_CRONTAB_SCHEDULE WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }
}
