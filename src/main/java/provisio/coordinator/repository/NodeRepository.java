package provisio.coordinator.repository;

import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.Reachability;
import provisio.coordinator.model.Resources;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for node persistence.
 * Abstracts database operations for backend nodes.
 */
public interface NodeRepository {

    // ========== CRUD ==========

    void save(Node node);

    Optional<Node> findById(String nodeId);

    List<Node> findAll();

    /** Nodes that are neither frozen nor expired at {@code now}. */
    List<Node> findProbeEligible(Instant now);

    /**
     * Lock the node row until the surrounding transaction ends.
     * Must be called inside a transaction.
     */
    Optional<Node> lockById(String nodeId);

    // ========== Administration ==========

    boolean updateCapacity(String nodeId, int cpu, long memoryMb, long diskMb,
            int maxInstances, int maxContainers, int maxVms);

    boolean updateConcurrencyPolicy(String nodeId, boolean allowConcurrentTasks, int maxConcurrentTasks);

    boolean updateConnection(String nodeId, String host, int sshPort, int apiPort, String username,
            String credential);

    boolean setFrozen(String nodeId, boolean frozen);

    boolean setExpiresAt(String nodeId, Instant expiresAt);

    boolean setLevelLimits(String nodeId, String levelLimitsJson);

    // ========== Committed counters ==========

    /** Add one instance of {@code kind} with the given footprint to the committed counters. */
    void commit(String nodeId, InstanceKind kind, Resources footprint);

    /** Remove one instance of {@code kind} from the committed counters, never below zero. */
    void release(String nodeId, InstanceKind kind, Resources footprint);

    // ========== Health ==========

    void updateHealth(String nodeId, NodeStatus status, Reachability sshStatus, Reachability apiStatus,
            boolean allowClaim, Instant checkedAt);

    void touchCheckedAt(String nodeId, Instant checkedAt);
}
