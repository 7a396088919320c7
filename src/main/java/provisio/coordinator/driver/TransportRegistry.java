package provisio.coordinator.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Lower-level transport state (SSH sessions, API clients) opened by drivers,
 * tracked per node so it can be torn down even when a driver's own
 * disconnect hangs or fails.
 */
public class TransportRegistry {

    private static final Logger log = LoggerFactory.getLogger(TransportRegistry.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<AutoCloseable>> byNode = new ConcurrentHashMap<>();

    public void register(String nodeId, AutoCloseable transport) {
        byNode.computeIfAbsent(nodeId, id -> new CopyOnWriteArrayList<>()).add(transport);
    }

    public int count(String nodeId) {
        List<AutoCloseable> list = byNode.get(nodeId);
        return list == null ? 0 : list.size();
    }

    /**
     * Close and forget every transport of the node. Close failures are logged.
     *
     * @return number of transports removed
     */
    public int removeAll(String nodeId) {
        List<AutoCloseable> removed = byNode.remove(nodeId);
        if (removed == null) {
            return 0;
        }
        for (AutoCloseable transport : removed) {
            try {
                transport.close();
            } catch (Exception e) {
                log.warn("Failed to close transport for node {}: {}", nodeId, e.getMessage());
            }
        }
        log.debug("Cleared {} transports for node {}", removed.size(), nodeId);
        return removed.size();
    }
}
