package provisio.coordinator.store;

import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskKind;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static provisio.coordinator.store.JdbcSupport.getEnum;
import static provisio.coordinator.store.JdbcSupport.getInstant;
import static provisio.coordinator.store.JdbcSupport.getResources;
import static provisio.coordinator.store.JdbcSupport.setResources;
import static provisio.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of TaskRepository.
 * Every transition is a conditional UPDATE on the expected source status,
 * so a late or duplicate transition reports false instead of overwriting.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, kind, status, progress, status_message, error_message, cancel_reason,
                                       created_at, started_at, completed_at, user_id, node_id, instance_id,
                                       instance_kind, payload, timeout_seconds, estimated_duration_seconds,
                                       cancellable, cpu, memory_mb, disk_mb, bandwidth_mbps,
                                       session_id, allocation_committed)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.withConnection("save task " + task.id(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, task.id());
                ps.setString(2, task.kind().name());
                ps.setString(3, task.status().name());
                ps.setInt(4, task.progress());
                ps.setString(5, task.statusMessage());
                ps.setString(6, task.errorMessage());
                ps.setString(7, task.cancelReason());
                setTimestamp(ps, 8, task.createdAt() != null ? task.createdAt() : Instant.now());
                setTimestamp(ps, 9, task.startedAt());
                setTimestamp(ps, 10, task.completedAt());
                ps.setString(11, task.userId());
                ps.setString(12, task.nodeId());
                ps.setString(13, task.instanceId());
                ps.setString(14, task.instanceKind().name());
                ps.setString(15, task.payload());
                ps.setInt(16, task.timeoutSeconds());
                ps.setInt(17, task.estimatedDurationSeconds());
                ps.setBoolean(18, task.cancellable());
                setResources(ps, 19, task.footprint());
                ps.setString(23, task.sessionId());
                ps.setBoolean(24, task.allocationCommitted());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return findOne("find task " + taskId, "SELECT * FROM tasks WHERE id = ?", taskId);
    }

    @Override
    public Optional<Task> lockById(String taskId) {
        return findOne("lock task " + taskId, "SELECT * FROM tasks WHERE id = ? FOR UPDATE", taskId);
    }

    @Override
    public List<Task> findByUser(String userId) {
        return list("list tasks of user " + userId,
                "SELECT * FROM tasks WHERE user_id = ? ORDER BY created_at DESC, id", userId);
    }

    @Override
    public List<Task> findByNode(String nodeId) {
        return list("list tasks of node " + nodeId,
                "SELECT * FROM tasks WHERE node_id = ? ORDER BY created_at DESC, id", nodeId);
    }

    @Override
    public List<Task> findPending(int limit) {
        return db.withConnection("list pending tasks", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM tasks WHERE status = 'PENDING' ORDER BY created_at, id LIMIT ?")) {
                ps.setInt(1, limit);
                return executeQuery(ps);
            }
        });
    }

    @Override
    public List<Task> findPendingByNode(String nodeId) {
        return list("list pending tasks of node " + nodeId,
                "SELECT * FROM tasks WHERE node_id = ? AND status = 'PENDING' ORDER BY created_at, id", nodeId);
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        return list("list tasks by status " + status,
                "SELECT * FROM tasks WHERE status = ? ORDER BY created_at, id", status.name());
    }

    @Override
    public boolean markRunning(String taskId, Instant startedAt) {
        String sql = """
                    UPDATE tasks
                    SET status = 'RUNNING', started_at = ?, status_message = 'Task started'
                    WHERE id = ? AND status = 'PENDING'
                """;

        return db.withConnection("start task " + taskId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, startedAt);
                ps.setString(2, taskId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean updateProgress(String taskId, int progress, String message) {
        String sql = """
                    UPDATE tasks
                    SET progress = ?, status_message = COALESCE(?, status_message)
                    WHERE id = ? AND status = 'RUNNING'
                """;

        return db.withConnection("update progress of task " + taskId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, progress);
                ps.setString(2, message);
                ps.setString(3, taskId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markCompleted(String taskId, String instanceId, Instant completedAt) {
        String sql = """
                    UPDATE tasks
                    SET status = 'COMPLETED', progress = 100, status_message = 'Task completed',
                        instance_id = COALESCE(?, instance_id), completed_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        return db.withConnection("complete task " + taskId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, instanceId);
                setTimestamp(ps, 2, completedAt);
                ps.setString(3, taskId);
                int updated = ps.executeUpdate();
                if (updated > 0) {
                    log.debug("Task {} completed", taskId);
                }
                return updated > 0;
            }
        });
    }

    @Override
    public boolean markFailed(String taskId, String errorMessage, Instant completedAt) {
        String sql = """
                    UPDATE tasks
                    SET status = 'FAILED', error_message = ?, status_message = 'Task failed', completed_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        return db.withConnection("fail task " + taskId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, truncate(errorMessage, 2048));
                setTimestamp(ps, 2, completedAt);
                ps.setString(3, taskId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markCancelled(String taskId, String reason, Instant completedAt) {
        String sql = """
                    UPDATE tasks
                    SET status = 'CANCELLED', cancel_reason = ?, status_message = 'Task cancelled', completed_at = ?
                    WHERE id = ? AND status IN ('PENDING', 'RUNNING')
                """;

        return db.withConnection("cancel task " + taskId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, truncate(reason, 1024));
                setTimestamp(ps, 2, completedAt);
                ps.setString(3, taskId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public int countRunningOnNode(String nodeId) {
        return db.withConnection("count running tasks of node " + nodeId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT COUNT(*) FROM tasks WHERE node_id = ? AND status = 'RUNNING'")) {
                ps.setString(1, nodeId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public Map<TaskStatus, Integer> countByStatus() {
        return db.withConnection("count tasks by status", conn -> {
            Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
            for (TaskStatus status : TaskStatus.values()) {
                counts.put(status, 0);
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT status, COUNT(*) AS cnt FROM tasks GROUP BY status");
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
                }
            }
            return counts;
        });
    }

    @Override
    public int deleteTerminalBefore(Instant cutoff) {
        String sql = """
                    DELETE FROM tasks
                    WHERE status IN ('COMPLETED', 'FAILED', 'CANCELLED') AND completed_at < ?
                """;

        return db.withConnection("purge terminal tasks", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, cutoff);
                return ps.executeUpdate();
            }
        });
    }

    // ========== Helper methods ==========

    private Optional<Task> findOne(String action, String sql, String taskId) {
        return db.withConnection(action, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, taskId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(mapRow(rs));
                    }
                }
                return Optional.empty();
            }
        });
    }

    private List<Task> list(String action, String sql, String param) {
        return db.withConnection(action, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, param);
                return executeQuery(ps);
            }
        });
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> tasks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tasks.add(mapRow(rs));
            }
        }
        return tasks;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .kind(TaskKind.valueOf(rs.getString("kind")))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .progress(rs.getInt("progress"))
                .statusMessage(rs.getString("status_message"))
                .errorMessage(rs.getString("error_message"))
                .cancelReason(rs.getString("cancel_reason"))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .completedAt(getInstant(rs, "completed_at"))
                .userId(rs.getString("user_id"))
                .nodeId(rs.getString("node_id"))
                .instanceId(rs.getString("instance_id"))
                .instanceKind(getEnum(rs, "instance_kind", InstanceKind.class, InstanceKind.CONTAINER))
                .payload(rs.getString("payload"))
                .timeoutSeconds(rs.getInt("timeout_seconds"))
                .estimatedDurationSeconds(rs.getInt("estimated_duration_seconds"))
                .cancellable(rs.getBoolean("cancellable"))
                .footprint(getResources(rs))
                .sessionId(rs.getString("session_id"))
                .allocationCommitted(rs.getBoolean("allocation_committed"))
                .build();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
