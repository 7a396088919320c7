package provisio.coordinator.service;

import provisio.coordinator.config.LevelLimitsJson;
import provisio.coordinator.driver.NodeConnectionCache;
import provisio.coordinator.model.LevelLimit;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.Resources;
import provisio.coordinator.model.Usage;
import provisio.coordinator.repository.NodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node administration: registration, capacity and concurrency policy,
 * connection settings, freeze and expiry.
 */
public class NodeService {

    private static final Logger log = LoggerFactory.getLogger(NodeService.class);

    /**
     * Headroom left on a node after committed allocations and unexpired
     * reservations. {@code -1} marks a dimension the node does not limit.
     */
    public record RemainingCapacity(int cpu, long memoryMb, long diskMb, int instances) {
    }

    private final NodeRepository nodes;
    private final ReservationService reservations;
    private final NodeConnectionCache connections;
    private final Clock clock;

    public NodeService(NodeRepository nodes, ReservationService reservations, NodeConnectionCache connections,
            Clock clock) {
        this.nodes = nodes;
        this.reservations = reservations;
        this.connections = connections;
        this.clock = clock;
    }

    /**
     * Register a node. A missing creation time is filled in.
     */
    public Node register(Node node) {
        if (node.host() == null || node.host().isBlank()) {
            throw new IllegalArgumentException("Node host is required");
        }
        Node saved = node.createdAt() == null ? node.toBuilder().createdAt(clock.instant()).build() : node;
        nodes.save(saved);
        log.info("Registered node {} ({} at {})", saved.id(), saved.kind(), saved.host());
        return saved;
    }

    public Optional<Node> findById(String nodeId) {
        return nodes.findById(nodeId);
    }

    public List<Node> findAll() {
        return nodes.findAll();
    }

    public void updateCapacity(String nodeId, int cpu, long memoryMb, long diskMb, int maxInstances,
            int maxContainers, int maxVms) {
        require(nodes.updateCapacity(nodeId, cpu, memoryMb, diskMb, maxInstances, maxContainers, maxVms), nodeId);
        log.info("Node {} capacity: cpu={} memory={}MB disk={}MB instances={} containers={} vms={}",
                nodeId, cpu, memoryMb, diskMb, maxInstances, maxContainers, maxVms);
    }

    public void updateConcurrencyPolicy(String nodeId, boolean allowConcurrentTasks, int maxConcurrentTasks) {
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
        }
        require(nodes.updateConcurrencyPolicy(nodeId, allowConcurrentTasks, maxConcurrentTasks), nodeId);
        log.info("Node {} concurrency: allow={} max={}", nodeId, allowConcurrentTasks, maxConcurrentTasks);
    }

    /**
     * Change how the node is reached. The cached driver handle is dropped so
     * the next task reconnects with the new settings.
     */
    public void updateConnection(String nodeId, String host, int sshPort, int apiPort, String username,
            String credential) {
        require(nodes.updateConnection(nodeId, host, sshPort, apiPort, username, credential), nodeId);
        connections.invalidate(nodeId);
        log.info("Node {} connection settings changed, cached handle dropped", nodeId);
    }

    public void freeze(String nodeId) {
        require(nodes.setFrozen(nodeId, true), nodeId);
        log.info("Node {} frozen", nodeId);
    }

    public void unfreeze(String nodeId) {
        require(nodes.setFrozen(nodeId, false), nodeId);
        log.info("Node {} unfrozen", nodeId);
    }

    /** @param expiresAt null clears the expiry */
    public void setExpiry(String nodeId, Instant expiresAt) {
        require(nodes.setExpiresAt(nodeId, expiresAt), nodeId);
        log.info("Node {} expiry set to {}", nodeId, expiresAt);
    }

    /** Per-level quota overrides for this node; an empty map removes them. */
    public void setLevelLimits(String nodeId, Map<Integer, LevelLimit> limits) {
        String json = limits == null || limits.isEmpty() ? null : LevelLimitsJson.write(limits);
        require(nodes.setLevelLimits(nodeId, json), nodeId);
    }

    public RemainingCapacity remainingCapacity(String nodeId) {
        Node node = nodes.findById(nodeId)
                .orElseThrow(() -> new NodeUnavailableException(nodeId, "Node not found: " + nodeId));
        Usage used = new Usage(node.committed(), node.containerCount(), node.vmCount())
                .plus(reservations.sumActiveForNode(nodeId));
        Resources r = used.resources();
        return new RemainingCapacity(
                (int) headroom(node.cpuCapacity(), r.cpu()),
                headroom(node.memoryCapacityMb(), r.memoryMb()),
                headroom(node.diskCapacityMb(), r.diskMb()),
                (int) headroom(node.maxInstances(), used.instances()));
    }

    private static long headroom(long capacity, long used) {
        return capacity <= 0 ? -1 : Math.max(0, capacity - used);
    }

    private static void require(boolean updated, String nodeId) {
        if (!updated) {
            throw new NodeUnavailableException(nodeId, "Node not found: " + nodeId);
        }
    }
}
