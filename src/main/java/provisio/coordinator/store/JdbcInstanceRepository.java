package provisio.coordinator.store;

import provisio.coordinator.model.Instance;
import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.InstanceStatus;
import provisio.coordinator.model.Usage;
import provisio.coordinator.repository.InstanceRepository;

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
 * JDBC implementation of InstanceRepository.
 */
public class JdbcInstanceRepository implements InstanceRepository {

    private final Database db;

    public JdbcInstanceRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Instance instance) {
        String sql = """
                    INSERT INTO instances (id, name, user_id, node_id, kind, status,
                                           cpu, memory_mb, disk_mb, bandwidth_mbps, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.withConnection("save instance " + instance.id(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, instance.id());
                ps.setString(2, instance.name());
                ps.setString(3, instance.userId());
                ps.setString(4, instance.nodeId());
                ps.setString(5, instance.kind().name());
                ps.setString(6, instance.status().name());
                setResources(ps, 7, instance.footprint());
                setTimestamp(ps, 11, instance.createdAt() != null ? instance.createdAt() : Instant.now());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<Instance> findById(String instanceId) {
        return db.withConnection("find instance " + instanceId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM instances WHERE id = ?")) {
                ps.setString(1, instanceId);
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
    public List<Instance> findByUser(String userId) {
        return db.withConnection("list instances of user " + userId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM instances WHERE user_id = ? ORDER BY created_at")) {
                ps.setString(1, userId);
                List<Instance> result = new ArrayList<>();
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
    public boolean updateStatus(String instanceId, InstanceStatus status) {
        return db.withConnection("update status of instance " + instanceId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE instances SET status = ? WHERE id = ?")) {
                ps.setString(1, status.name());
                ps.setString(2, instanceId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Usage sumActiveForUser(String userId) {
        String sql = """
                    SELECT COALESCE(SUM(cpu), 0) AS cpu,
                           COALESCE(SUM(memory_mb), 0) AS memory_mb,
                           COALESCE(SUM(disk_mb), 0) AS disk_mb,
                           COALESCE(SUM(bandwidth_mbps), 0) AS bandwidth_mbps,
                           COALESCE(SUM(CASE WHEN kind = 'CONTAINER' THEN 1 ELSE 0 END), 0) AS containers,
                           COALESCE(SUM(CASE WHEN kind = 'VM' THEN 1 ELSE 0 END), 0) AS vms
                    FROM instances
                    WHERE user_id = ? AND status <> 'DELETED'
                """;

        return db.withConnection("sum instances of user " + userId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Usage.NONE;
                    }
                    return new Usage(getResources(rs), rs.getInt("containers"), rs.getInt("vms"));
                }
            }
        });
    }

    private Instance mapRow(ResultSet rs) throws SQLException {
        return new Instance(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("user_id"),
                rs.getString("node_id"),
                InstanceKind.valueOf(rs.getString("kind")),
                InstanceStatus.valueOf(rs.getString("status")),
                getResources(rs),
                getInstant(rs, "created_at"));
    }
}
