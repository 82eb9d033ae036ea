package net.dbbeat.adapter.jdbc.repo;

import net.dbbeat.core.spi.ChangeMarkerRepository;

import java.sql.*;
import java.time.Instant;
import java.util.Optional;

import static net.dbbeat.adapter.jdbc.JdbcUtil.*;

public final class JdbcChangeMarkerRepository implements ChangeMarkerRepository {
    static final long MARKER_ID = 1L;

    @Override
    public Optional<Instant> lastUpdate() throws Exception {
        try (PreparedStatement ps = conn().prepareStatement(
                "SELECT LAST_UPDATE FROM TB_PERIODIC_JOB_CHANGED WHERE ID = ?")) {
            ps.setLong(1, MARKER_ID);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.ofNullable(toInstant(rs.getTimestamp(1)));
            }
        }
    }

    @Override
    public Instant touch(Instant now) throws Exception {
        Connection c = conn();
        try (PreparedStatement up = c.prepareStatement(
                "UPDATE TB_PERIODIC_JOB_CHANGED SET LAST_UPDATE = ? WHERE ID = ?")) {
            up.setTimestamp(1, ts(now));
            up.setLong(2, MARKER_ID);
            if (up.executeUpdate() > 0) return now;
        }
        // 마이그레이션 seed 가 지워진 경우
        try (PreparedStatement ins = c.prepareStatement(
                "INSERT INTO TB_PERIODIC_JOB_CHANGED (ID, LAST_UPDATE) VALUES (?, ?)")) {
            ins.setLong(1, MARKER_ID);
            ins.setTimestamp(2, ts(now));
            ins.executeUpdate();
        }
        return now;
    }
}
