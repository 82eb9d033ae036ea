package net.dbbeat.adapter.jdbc.repo;

import net.dbbeat.adapter.jdbc.mapper.RowMappers;
import net.dbbeat.core.model.IntervalSchedule;
import net.dbbeat.core.model.IntervalUnit;
import net.dbbeat.core.spi.IntervalScheduleRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.dbbeat.adapter.jdbc.JdbcUtil.*;

public final class JdbcIntervalScheduleRepository implements IntervalScheduleRepository {

    @Override
    public IntervalSchedule getOrCreate(long every, IntervalUnit unit) throws Exception {
        Optional<IntervalSchedule> existing = find(every, unit);
        if (existing.isPresent()) return existing.get();

        // MERGE 대신 조회 후 INSERT. 동시 생성으로 유니크 위반이면 다시 조회
        try (PreparedStatement ps = conn().prepareStatement(
                "INSERT INTO TB_INTERVAL_SCHEDULE (EVERY_COUNT, PERIOD_UNIT) VALUES (?, ?)", new String[]{"ID"})) {
            ps.setLong(1, every);
            ps.setString(2, unit.code());
            ps.executeUpdate();
            return new IntervalSchedule(generatedId(ps), every, unit);
        } catch (SQLIntegrityConstraintViolationException dup) {
            return find(every, unit).orElseThrow(() -> dup);
        }
    }

    private Optional<IntervalSchedule> find(long every, IntervalUnit unit) throws SQLException {
        try (PreparedStatement ps = conn().prepareStatement("""
                SELECT ID, EVERY_COUNT, PERIOD_UNIT
                  FROM TB_INTERVAL_SCHEDULE
                 WHERE EVERY_COUNT = ? AND PERIOD_UNIT = ?
            """)) {
            ps.setLong(1, every);
            ps.setString(2, unit.code());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toInterval(rs));
            }
        }
    }

    @Override
    public Optional<IntervalSchedule> findById(long id) throws Exception {
        try (PreparedStatement ps = conn().prepareStatement(
                "SELECT ID, EVERY_COUNT, PERIOD_UNIT FROM TB_INTERVAL_SCHEDULE WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toInterval(rs));
            }
        }
    }

    @Override
    public List<IntervalSchedule> findAll() throws Exception {
        List<IntervalSchedule> out = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(
                "SELECT ID, EVERY_COUNT, PERIOD_UNIT FROM TB_INTERVAL_SCHEDULE ORDER BY ID");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toInterval(rs));
        }
        return out;
    }

    @Override
    public boolean delete(long id) throws Exception {
        // 참조하던 job 의 INTERVAL_ID 는 FK(ON DELETE SET NULL)로 비워진다
        try (PreparedStatement ps = conn().prepareStatement("DELETE FROM TB_INTERVAL_SCHEDULE WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }
}
