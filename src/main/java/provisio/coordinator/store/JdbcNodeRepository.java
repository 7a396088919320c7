package provisio.coordinator.store;

import provisio.coordinator.model.BackendKind;
import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.Reachability;
import provisio.coordinator.model.Resources;
import provisio.coordinator.repository.NodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static provisio.coordinator.store.JdbcSupport.getEnum;
import static provisio.coordinator.store.JdbcSupport.getInstant;
import static provisio.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of NodeRepository.
 * Committed counters are adjusted with relative updates so concurrent
 * commits and releases never overwrite each other.
 */
public class JdbcNodeRepository implements NodeRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcNodeRepository.class);

    private final Database db;

    public JdbcNodeRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Node node) {
        String sql = """
                    INSERT INTO nodes (id, name, kind, host, ssh_port, api_port, username, credential,
                                       cpu_capacity, memory_capacity_mb, disk_capacity_mb,
                                       max_instances, max_containers, max_vms,
                                       used_cpu, used_memory_mb, used_disk_mb, container_count, vm_count,
                                       allow_concurrent_tasks, max_concurrent_tasks, allow_claim, frozen, expires_at,
                                       status, ssh_status, api_status, last_checked_at, level_limits, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.withConnection("save node " + node.id(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, node.id());
                ps.setString(2, node.name());
                ps.setString(3, node.kind().name());
                ps.setString(4, node.host());
                ps.setInt(5, node.sshPort());
                ps.setInt(6, node.apiPort());
                ps.setString(7, node.username());
                ps.setString(8, node.credential());
                ps.setInt(9, node.cpuCapacity());
                ps.setLong(10, node.memoryCapacityMb());
                ps.setLong(11, node.diskCapacityMb());
                ps.setInt(12, node.maxInstances());
                ps.setInt(13, node.maxContainers());
                ps.setInt(14, node.maxVms());
                ps.setInt(15, node.usedCpu());
                ps.setLong(16, node.usedMemoryMb());
                ps.setLong(17, node.usedDiskMb());
                ps.setInt(18, node.containerCount());
                ps.setInt(19, node.vmCount());
                ps.setBoolean(20, node.allowConcurrentTasks());
                ps.setInt(21, node.maxConcurrentTasks());
                ps.setBoolean(22, node.allowClaim());
                ps.setBoolean(23, node.frozen());
                setTimestamp(ps, 24, node.expiresAt());
                ps.setString(25, node.status().name());
                ps.setString(26, node.sshStatus().name());
                ps.setString(27, node.apiStatus().name());
                setTimestamp(ps, 28, node.lastCheckedAt());
                ps.setString(29, node.levelLimits());
                setTimestamp(ps, 30, node.createdAt() != null ? node.createdAt() : Instant.now());
                return ps.executeUpdate();
            }
        });
        log.debug("Saved node {}", node.id());
    }

    @Override
    public Optional<Node> findById(String nodeId) {
        return findOne("find node " + nodeId, "SELECT * FROM nodes WHERE id = ?", nodeId);
    }

    @Override
    public Optional<Node> lockById(String nodeId) {
        return findOne("lock node " + nodeId, "SELECT * FROM nodes WHERE id = ? FOR UPDATE", nodeId);
    }

    @Override
    public List<Node> findAll() {
        return db.withConnection("list nodes", conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM nodes ORDER BY created_at, id")) {
                return executeQuery(ps);
            }
        });
    }

    @Override
    public List<Node> findProbeEligible(Instant now) {
        String sql = """
                    SELECT * FROM nodes
                    WHERE frozen = FALSE AND (expires_at IS NULL OR expires_at > ?)
                    ORDER BY id
                """;

        return db.withConnection("list probe-eligible nodes", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, now);
                return executeQuery(ps);
            }
        });
    }

    @Override
    public boolean updateCapacity(String nodeId, int cpu, long memoryMb, long diskMb,
            int maxInstances, int maxContainers, int maxVms) {
        String sql = """
                    UPDATE nodes
                    SET cpu_capacity = ?, memory_capacity_mb = ?, disk_capacity_mb = ?,
                        max_instances = ?, max_containers = ?, max_vms = ?
                    WHERE id = ?
                """;

        return db.withConnection("update capacity of node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, cpu);
                ps.setLong(2, memoryMb);
                ps.setLong(3, diskMb);
                ps.setInt(4, maxInstances);
                ps.setInt(5, maxContainers);
                ps.setInt(6, maxVms);
                ps.setString(7, nodeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean updateConcurrencyPolicy(String nodeId, boolean allowConcurrentTasks, int maxConcurrentTasks) {
        return db.withConnection("update concurrency policy of node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE nodes SET allow_concurrent_tasks = ?, max_concurrent_tasks = ? WHERE id = ?")) {
                ps.setBoolean(1, allowConcurrentTasks);
                ps.setInt(2, maxConcurrentTasks);
                ps.setString(3, nodeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean updateConnection(String nodeId, String host, int sshPort, int apiPort, String username,
            String credential) {
        String sql = """
                    UPDATE nodes
                    SET host = ?, ssh_port = ?, api_port = ?, username = ?, credential = ?
                    WHERE id = ?
                """;

        return db.withConnection("update connection of node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, host);
                ps.setInt(2, sshPort);
                ps.setInt(3, apiPort);
                ps.setString(4, username);
                ps.setString(5, credential);
                ps.setString(6, nodeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean setFrozen(String nodeId, boolean frozen) {
        return db.withConnection("set frozen on node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE nodes SET frozen = ? WHERE id = ?")) {
                ps.setBoolean(1, frozen);
                ps.setString(2, nodeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean setExpiresAt(String nodeId, Instant expiresAt) {
        return db.withConnection("set expiry on node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE nodes SET expires_at = ? WHERE id = ?")) {
                setTimestamp(ps, 1, expiresAt);
                ps.setString(2, nodeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean setLevelLimits(String nodeId, String levelLimitsJson) {
        return db.withConnection("set level limits on node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE nodes SET level_limits = ? WHERE id = ?")) {
                ps.setString(1, levelLimitsJson);
                ps.setString(2, nodeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void commit(String nodeId, InstanceKind kind, Resources footprint) {
        String sql = """
                    UPDATE nodes
                    SET used_cpu = used_cpu + ?, used_memory_mb = used_memory_mb + ?, used_disk_mb = used_disk_mb + ?,
                        container_count = container_count + ?, vm_count = vm_count + ?
                    WHERE id = ?
                """;

        db.withConnection("commit resources on node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, footprint.cpu());
                ps.setLong(2, footprint.memoryMb());
                ps.setLong(3, footprint.diskMb());
                ps.setInt(4, kind == InstanceKind.CONTAINER ? 1 : 0);
                ps.setInt(5, kind == InstanceKind.VM ? 1 : 0);
                ps.setString(6, nodeId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void release(String nodeId, InstanceKind kind, Resources footprint) {
        String sql = """
                    UPDATE nodes
                    SET used_cpu = GREATEST(used_cpu - ?, 0),
                        used_memory_mb = GREATEST(used_memory_mb - ?, 0),
                        used_disk_mb = GREATEST(used_disk_mb - ?, 0),
                        container_count = GREATEST(container_count - ?, 0),
                        vm_count = GREATEST(vm_count - ?, 0)
                    WHERE id = ?
                """;

        db.withConnection("release resources on node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, footprint.cpu());
                ps.setLong(2, footprint.memoryMb());
                ps.setLong(3, footprint.diskMb());
                ps.setInt(4, kind == InstanceKind.CONTAINER ? 1 : 0);
                ps.setInt(5, kind == InstanceKind.VM ? 1 : 0);
                ps.setString(6, nodeId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void updateHealth(String nodeId, NodeStatus status, Reachability sshStatus, Reachability apiStatus,
            boolean allowClaim, Instant checkedAt) {
        String sql = """
                    UPDATE nodes
                    SET status = ?, ssh_status = ?, api_status = ?, allow_claim = ?, last_checked_at = ?
                    WHERE id = ?
                """;

        db.withConnection("update health of node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, status.name());
                ps.setString(2, sshStatus.name());
                ps.setString(3, apiStatus.name());
                ps.setBoolean(4, allowClaim);
                setTimestamp(ps, 5, checkedAt);
                ps.setString(6, nodeId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void touchCheckedAt(String nodeId, Instant checkedAt) {
        db.withConnection("touch node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE nodes SET last_checked_at = ? WHERE id = ?")) {
                setTimestamp(ps, 1, checkedAt);
                ps.setString(2, nodeId);
                return ps.executeUpdate();
            }
        });
    }

    // ========== Helper methods ==========

    private Optional<Node> findOne(String action, String sql, String nodeId) {
        return db.withConnection(action, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, nodeId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(mapRow(rs));
                    }
                }
                return Optional.empty();
            }
        });
    }

    private List<Node> executeQuery(PreparedStatement ps) throws SQLException {
        List<Node> nodes = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                nodes.add(mapRow(rs));
            }
        }
        return nodes;
    }

    private Node mapRow(ResultSet rs) throws SQLException {
        return Node.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .kind(BackendKind.valueOf(rs.getString("kind")))
                .host(rs.getString("host"))
                .sshPort(rs.getInt("ssh_port"))
                .apiPort(rs.getInt("api_port"))
                .username(rs.getString("username"))
                .credential(rs.getString("credential"))
                .cpuCapacity(rs.getInt("cpu_capacity"))
                .memoryCapacityMb(rs.getLong("memory_capacity_mb"))
                .diskCapacityMb(rs.getLong("disk_capacity_mb"))
                .maxInstances(rs.getInt("max_instances"))
                .maxContainers(rs.getInt("max_containers"))
                .maxVms(rs.getInt("max_vms"))
                .usedCpu(rs.getInt("used_cpu"))
                .usedMemoryMb(rs.getLong("used_memory_mb"))
                .usedDiskMb(rs.getLong("used_disk_mb"))
                .containerCount(rs.getInt("container_count"))
                .vmCount(rs.getInt("vm_count"))
                .allowConcurrentTasks(rs.getBoolean("allow_concurrent_tasks"))
                .maxConcurrentTasks(rs.getInt("max_concurrent_tasks"))
                .allowClaim(rs.getBoolean("allow_claim"))
                .frozen(rs.getBoolean("frozen"))
                .expiresAt(getInstant(rs, "expires_at"))
                .status(getEnum(rs, "status", NodeStatus.class, NodeStatus.ACTIVE))
                .sshStatus(getEnum(rs, "ssh_status", Reachability.class, Reachability.UNKNOWN))
                .apiStatus(getEnum(rs, "api_status", Reachability.class, Reachability.UNKNOWN))
                .lastCheckedAt(getInstant(rs, "last_checked_at"))
                .levelLimits(rs.getString("level_limits"))
                .createdAt(getInstant(rs, "created_at"))
                .build();
    }
}
