package provisio.coordinator.health;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.core.CoordinatorBus;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.repository.NodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically probes every non-frozen, non-expired node and records its
 * reachability.
 *
 * <p>Claim eligibility follows the status: a node that becomes INACTIVE stops
 * accepting new instances, and it accepts them again once it recovers to
 * PARTIAL or ACTIVE (or moves from PARTIAL to ACTIVE). A probe that times out
 * or throws leaves the status alone and only stamps the check time.
 * Tasks and instances are never touched here.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final NodeRepository nodes;
    private final NodeProbe probe;
    private final CoordinatorBus bus;
    private final Clock clock;
    private final Duration busyInterval;
    private final Duration idleInterval;
    private final Duration probeTimeout;
    private final ExecutorService workers;
    private final ExecutorService probeCalls;
    private final Set<String> probesInFlight = ConcurrentHashMap.newKeySet();

    public HealthMonitor(NodeRepository nodes, NodeProbe probe, CoordinatorBus bus, CoordinatorConfig config,
            Clock clock) {
        this.nodes = nodes;
        this.probe = probe;
        this.bus = bus;
        this.clock = clock;
        this.busyInterval = config.healthBusyInterval();
        this.idleInterval = config.healthIdleInterval();
        this.probeTimeout = config.healthProbeTimeout();
        int poolSize = Math.max(1, config.healthWorkers());
        this.workers = Executors.newFixedThreadPool(poolSize, namedDaemon("provisio-health"));
        this.probeCalls = Executors.newFixedThreadPool(poolSize, namedDaemon("provisio-probe"));
    }

    /**
     * Probe all eligible nodes and wait for the results.
     *
     * @return delay until the next round: short while there are nodes to watch
     */
    public Duration runOnce() {
        List<Node> eligible = nodes.findProbeEligible(clock.instant());
        if (eligible.isEmpty()) {
            log.debug("No nodes to probe, next check in {}", idleInterval);
            return idleInterval;
        }
        warnOnHostConflicts(eligible);

        List<Callable<Boolean>> checks = new ArrayList<>(eligible.size());
        for (Node node : eligible) {
            checks.add(() -> check(node));
        }
        int changed = 0;
        try {
            for (Future<Boolean> f : workers.invokeAll(checks)) {
                try {
                    if (Boolean.TRUE.equals(f.get())) {
                        changed++;
                    }
                } catch (ExecutionException e) {
                    log.error("Health check failed", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Health round interrupted");
        }
        log.info("Health round: {} nodes probed, {} changed status", eligible.size(), changed);
        return busyInterval;
    }

    /**
     * Probe one node and apply the result. A node whose previous probe has
     * not returned yet is skipped.
     *
     * @return true if the node's status changed
     */
    boolean check(Node node) {
        String nodeId = node.id();
        if (!probesInFlight.add(nodeId)) {
            log.warn("Previous probe of node {} still running, skipped this round", nodeId);
            return false;
        }
        AtomicBoolean claimed = new AtomicBoolean();
        Future<ProbeResult> future;
        try {
            future = probeCalls.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return probe.probe(node);
                } finally {
                    probesInFlight.remove(nodeId);
                }
            });
        } catch (RejectedExecutionException e) {
            probesInFlight.remove(nodeId);
            log.debug("Probe of node {} not started, monitor is closing", nodeId);
            return false;
        }

        ProbeResult result;
        try {
            result = future.get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(nodeId, future, claimed);
            log.warn("Probe of node {} timed out after {}ms, status left as {}",
                    nodeId, probeTimeout.toMillis(), node.status());
            nodes.touchCheckedAt(nodeId, clock.instant());
            return false;
        } catch (ExecutionException e) {
            log.warn("Probe of node {} failed, status left as {}: {}",
                    nodeId, node.status(), e.getCause().getMessage());
            nodes.touchCheckedAt(nodeId, clock.instant());
            return false;
        } catch (InterruptedException e) {
            abandon(nodeId, future, claimed);
            Thread.currentThread().interrupt();
            return false;
        }
        return apply(node, result);
    }

    /**
     * Give up waiting on a probe. One that never started is dropped and frees
     * its node; one already running keeps the node marked until it returns.
     */
    private void abandon(String nodeId, Future<ProbeResult> future, AtomicBoolean claimed) {
        if (claimed.compareAndSet(false, true)) {
            probesInFlight.remove(nodeId);
        }
        future.cancel(true);
    }

    private boolean apply(Node node, ProbeResult result) {
        NodeStatus previous = node.status();
        NodeStatus current = result.status();
        boolean allowClaim = nextAllowClaim(previous, current, node.allowClaim());
        Instant now = clock.instant();

        nodes.updateHealth(node.id(), current, result.ssh(), result.api(), allowClaim, now);

        if (previous == current) {
            return false;
        }
        log.info("Node {} status {} -> {} (ssh={}, api={}, allowClaim={})",
                node.id(), previous, current, result.ssh(), result.api(), allowClaim);
        bus.fireNodeHealthChanged(new CoordinatorBus.NodeHealthChange(node.id(), previous, current, allowClaim));
        return true;
    }

    static boolean nextAllowClaim(NodeStatus previous, NodeStatus current, boolean allowClaim) {
        if (current == NodeStatus.INACTIVE) {
            return false;
        }
        if (previous == NodeStatus.INACTIVE) {
            return true;
        }
        if (previous == NodeStatus.PARTIAL && current == NodeStatus.ACTIVE) {
            return true;
        }
        return allowClaim;
    }

    private void warnOnHostConflicts(List<Node> eligible) {
        Map<String, List<String>> byHost = new HashMap<>();
        for (Node node : eligible) {
            if (node.host() == null) {
                continue;
            }
            String key = node.kind() + "@" + node.host().toLowerCase(Locale.ROOT);
            byHost.computeIfAbsent(key, k -> new ArrayList<>()).add(node.id());
        }
        byHost.forEach((key, ids) -> {
            if (ids.size() > 1) {
                log.warn("Hostname conflict: nodes {} share {}", ids, key);
            }
        });
    }

    @Override
    public void close() {
        workers.shutdownNow();
        probeCalls.shutdownNow();
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
