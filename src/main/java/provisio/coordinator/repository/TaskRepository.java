package provisio.coordinator.repository;

import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for the task ledger.
 * Status transitions are conditional updates and report whether they applied.
 */
public interface TaskRepository {

    // ========== CRUD ==========

    void save(Task task);

    Optional<Task> findById(String taskId);

    /** Lock the task row until the surrounding transaction ends. */
    Optional<Task> lockById(String taskId);

    List<Task> findByUser(String userId);

    List<Task> findByNode(String nodeId);

    /** PENDING tasks across all nodes, oldest first. */
    List<Task> findPending(int limit);

    /** PENDING tasks on one node, oldest first. */
    List<Task> findPendingByNode(String nodeId);

    List<Task> findByStatus(TaskStatus status);

    // ========== Transitions ==========

    /** PENDING → RUNNING. */
    boolean markRunning(String taskId, Instant startedAt);

    /** Progress update, applies only while RUNNING. */
    boolean updateProgress(String taskId, int progress, String message);

    /** RUNNING → COMPLETED. */
    boolean markCompleted(String taskId, String instanceId, Instant completedAt);

    /** RUNNING → FAILED. */
    boolean markFailed(String taskId, String errorMessage, Instant completedAt);

    /** PENDING or RUNNING → CANCELLED. */
    boolean markCancelled(String taskId, String reason, Instant completedAt);

    // ========== Statistics / housekeeping ==========

    int countRunningOnNode(String nodeId);

    Map<TaskStatus, Integer> countByStatus();

    /** Delete terminal tasks completed before {@code cutoff}. */
    int deleteTerminalBefore(Instant cutoff);
}
