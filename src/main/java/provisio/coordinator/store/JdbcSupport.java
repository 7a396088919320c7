package provisio.coordinator.store;

import provisio.coordinator.model.Resources;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Column helpers shared by the JDBC repositories.
 */
final class JdbcSupport {

    private JdbcSupport() {
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    /** Reads cpu, memory_mb, disk_mb, bandwidth_mbps columns. */
    static Resources getResources(ResultSet rs) throws SQLException {
        return new Resources(
                rs.getInt("cpu"),
                rs.getLong("memory_mb"),
                rs.getLong("disk_mb"),
                rs.getInt("bandwidth_mbps"));
    }

    /** Binds a footprint to four consecutive parameters starting at {@code index}. */
    static void setResources(PreparedStatement ps, int index, Resources r) throws SQLException {
        ps.setInt(index, r.cpu());
        ps.setLong(index + 1, r.memoryMb());
        ps.setLong(index + 2, r.diskMb());
        ps.setInt(index + 3, r.bandwidthMbps());
    }

    static <E extends Enum<E>> E getEnum(ResultSet rs, String column, Class<E> type, E fallback) throws SQLException {
        String value = rs.getString(column);
        if (value == null) {
            return fallback;
        }
        return Enum.valueOf(type, value);
    }
}
