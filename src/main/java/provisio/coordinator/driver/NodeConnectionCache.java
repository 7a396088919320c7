package provisio.coordinator.driver;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.model.Node;
import provisio.coordinator.repository.NodeRepository;
import provisio.coordinator.service.NodeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Process-local cache of connected driver handles, one per node.
 *
 * <p>A handle is reused while the node's connection fingerprint is unchanged
 * and it is neither idle past the idle timeout nor older than the maximum
 * lifetime. Work on one node key is serialized; different nodes never
 * block each other. Evicting a handle disconnects it with a bounded wait and
 * then always clears the node's transports.
 */
public class NodeConnectionCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeConnectionCache.class);

    static final class Entry {
        final NodeDriver driver;
        final String fingerprint;
        final Instant createdAt;
        volatile Instant lastAccess;

        Entry(NodeDriver driver, String fingerprint, Instant now) {
            this.driver = driver;
            this.fingerprint = fingerprint;
            this.createdAt = now;
            this.lastAccess = now;
        }
    }

    private final KeyedCache<String, Entry> entries;
    private final ConcurrentHashMap<String, Object> keyLocks = new ConcurrentHashMap<>();
    private final DriverRegistry drivers;
    private final TransportRegistry transports;
    private final NodeRepository nodes;
    private final Duration idleTimeout;
    private final Duration maxLifetime;
    private final Duration disconnectTimeout;
    private final Clock clock;
    private final ExecutorService disconnectExecutor;

    public NodeConnectionCache(DriverRegistry drivers, TransportRegistry transports, NodeRepository nodes,
            CoordinatorConfig config, Clock clock) {
        this(new ConcurrentKeyedCache<>(), drivers, transports, nodes, config, clock);
    }

    NodeConnectionCache(KeyedCache<String, Entry> entries, DriverRegistry drivers,
            TransportRegistry transports, NodeRepository nodes, CoordinatorConfig config, Clock clock) {
        this.entries = entries;
        this.drivers = drivers;
        this.transports = transports;
        this.nodes = nodes;
        this.idleTimeout = config.connectionIdleTimeout();
        this.maxLifetime = config.connectionMaxLifetime();
        this.disconnectTimeout = config.disconnectTimeout();
        this.clock = clock;
        this.disconnectExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "provisio-disconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Handle for the node's current connection settings.
     *
     * @throws DriverException if no driver exists for the node's kind or connecting fails
     */
    public NodeDriver getOrCreate(Node node) {
        return getOrCreate(node, ConnectionFingerprint.of(node));
    }

    /**
     * Handle for a node looked up by id.
     *
     * @throws NodeUnavailableException if the node does not exist
     */
    public NodeDriver getOrCreate(String nodeId, String fingerprint) {
        Node node = nodes.findById(nodeId)
                .orElseThrow(() -> new NodeUnavailableException(nodeId, "Node not found: " + nodeId));
        return getOrCreate(node, fingerprint);
    }

    private NodeDriver getOrCreate(Node node, String fingerprint) {
        String nodeId = node.id();
        synchronized (lockFor(nodeId)) {
            Instant now = clock.instant();
            Optional<Entry> cached = entries.get(nodeId);
            if (cached.isPresent()) {
                Entry entry = cached.get();
                if (entry.fingerprint.equals(fingerprint) && !isStale(entry, now) && entry.driver.isConnected()) {
                    entry.lastAccess = now;
                    return entry.driver;
                }
                log.info("Replacing cached connection for node {} (settings changed, stale or disconnected)", nodeId);
                entries.remove(nodeId);
                disconnect(nodeId, entry.driver);
            }

            NodeDriver driver = drivers.newDriver(node, transports);
            try {
                driver.connect();
            } catch (RuntimeException e) {
                transports.removeAll(nodeId);
                throw e instanceof DriverException de
                        ? de
                        : new DriverException("Failed to connect to node " + nodeId + ": " + e.getMessage(), e);
            }
            entries.put(nodeId, new Entry(driver, fingerprint, now));
            log.info("Connected to node {} ({})", nodeId, node.kind());
            return driver;
        }
    }

    /** Drop and disconnect the node's handle, if any. */
    public void invalidate(String nodeId) {
        synchronized (lockFor(nodeId)) {
            entries.remove(nodeId).ifPresent(entry -> {
                log.info("Invalidated connection for node {}", nodeId);
                disconnect(nodeId, entry.driver);
            });
        }
    }

    /**
     * Evict handles idle past the idle timeout or older than the maximum lifetime.
     *
     * @return number of evicted handles
     */
    public int sweep() {
        int evicted = 0;
        for (String nodeId : entries.keys()) {
            synchronized (lockFor(nodeId)) {
                Optional<Entry> entry = entries.get(nodeId);
                if (entry.isPresent() && isStale(entry.get(), clock.instant())) {
                    entries.remove(nodeId);
                    disconnect(nodeId, entry.get().driver);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} node connections, {} remain", evicted, entries.size());
        }
        return evicted;
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String nodeId) {
        return entries.get(nodeId).isPresent();
    }

    /** Disconnect everything. */
    public void closeAll() {
        for (String nodeId : entries.keys()) {
            invalidate(nodeId);
        }
    }

    @Override
    public void close() {
        closeAll();
        disconnectExecutor.shutdownNow();
    }

    private boolean isStale(Entry entry, Instant now) {
        return Duration.between(entry.lastAccess, now).compareTo(idleTimeout) > 0
                || Duration.between(entry.createdAt, now).compareTo(maxLifetime) > 0;
    }

    private Object lockFor(String nodeId) {
        return keyLocks.computeIfAbsent(nodeId, id -> new Object());
    }

    /**
     * Disconnect with a bounded wait. Transports are cleared whatever the outcome.
     */
    private void disconnect(String nodeId, NodeDriver driver) {
        Future<?> future = disconnectExecutor.submit(driver::disconnect);
        try {
            future.get(disconnectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Disconnect from node {} timed out after {}ms", nodeId, disconnectTimeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("Disconnect from node {} failed: {}", nodeId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while disconnecting from node {}", nodeId);
        } finally {
            transports.removeAll(nodeId);
        }
    }
}
