package provisio.coordinator.store;

import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.Reservation;
import provisio.coordinator.model.Usage;
import provisio.coordinator.repository.ReservationRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static provisio.coordinator.store.JdbcSupport.getInstant;
import static provisio.coordinator.store.JdbcSupport.getResources;
import static provisio.coordinator.store.JdbcSupport.setResources;
import static provisio.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of ReservationRepository.
 * "Active" always means {@code expires_at > now}; expired rows are ignored
 * by every aggregate even before the reaper deletes them.
 */
public class JdbcReservationRepository implements ReservationRepository {

    private static final String SUM_COLUMNS = """
                COALESCE(SUM(cpu), 0) AS cpu,
                COALESCE(SUM(memory_mb), 0) AS memory_mb,
                COALESCE(SUM(disk_mb), 0) AS disk_mb,
                COALESCE(SUM(bandwidth_mbps), 0) AS bandwidth_mbps,
                COALESCE(SUM(CASE WHEN instance_kind = 'CONTAINER' THEN 1 ELSE 0 END), 0) AS containers,
                COALESCE(SUM(CASE WHEN instance_kind = 'VM' THEN 1 ELSE 0 END), 0) AS vms
            """;

    private final Database db;

    public JdbcReservationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Reservation r) {
        String sql = """
                    INSERT INTO reservations (id, session_id, user_id, node_id, instance_kind,
                                              cpu, memory_mb, disk_mb, bandwidth_mbps, created_at, expires_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.withConnection("save reservation " + r.sessionId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, r.id());
                ps.setString(2, r.sessionId());
                ps.setString(3, r.userId());
                ps.setString(4, r.nodeId());
                ps.setString(5, r.instanceKind().name());
                setResources(ps, 6, r.footprint());
                setTimestamp(ps, 10, r.createdAt());
                setTimestamp(ps, 11, r.expiresAt());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<Reservation> findBySession(String sessionId) {
        return db.withConnection("find reservation " + sessionId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM reservations WHERE session_id = ?")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(mapRow(rs));
                    }
                }
                return Optional.empty();
            }
        });
    }

    @Override
    public boolean deleteBySession(String sessionId) {
        return db.withConnection("delete reservation " + sessionId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM reservations WHERE session_id = ?")) {
                ps.setString(1, sessionId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public int deleteExpired(Instant now) {
        return db.withConnection("delete expired reservations", conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM reservations WHERE expires_at <= ?")) {
                setTimestamp(ps, 1, now);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public List<Reservation> findActive(Instant now) {
        return db.withConnection("list active reservations", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM reservations WHERE expires_at > ? ORDER BY created_at")) {
                setTimestamp(ps, 1, now);
                List<Reservation> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapRow(rs));
                    }
                }
                return result;
            }
        });
    }

    @Override
    public int countActive(Instant now) {
        return db.withConnection("count active reservations", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT COUNT(*) FROM reservations WHERE expires_at > ?")) {
                setTimestamp(ps, 1, now);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public Usage sumActiveForNode(String nodeId, Instant now) {
        return sum("sum reservations on node " + nodeId, "node_id", nodeId, now);
    }

    @Override
    public Usage sumActiveForUser(String userId, Instant now) {
        return sum("sum reservations of user " + userId, "user_id", userId, now);
    }

    private Usage sum(String action, String column, String value, Instant now) {
        String sql = "SELECT " + SUM_COLUMNS + " FROM reservations WHERE " + column + " = ? AND expires_at > ?";

        return db.withConnection(action, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, value);
                setTimestamp(ps, 2, now);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Usage.NONE;
                    }
                    return new Usage(getResources(rs), rs.getInt("containers"), rs.getInt("vms"));
                }
            }
        });
    }

    private Reservation mapRow(ResultSet rs) throws SQLException {
        return new Reservation(
                rs.getString("id"),
                rs.getString("session_id"),
                rs.getString("user_id"),
                rs.getString("node_id"),
                InstanceKind.valueOf(rs.getString("instance_kind")),
                getResources(rs),
                getInstant(rs, "created_at"),
                getInstant(rs, "expires_at"));
    }
}
