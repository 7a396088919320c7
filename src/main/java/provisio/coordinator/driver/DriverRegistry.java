package provisio.coordinator.driver;

import provisio.coordinator.model.BackendKind;
import provisio.coordinator.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Driver factories keyed by backend kind, registered at startup.
 */
public final class DriverRegistry {

    private static final Logger log = LoggerFactory.getLogger(DriverRegistry.class);

    private final Map<BackendKind, NodeDriverFactory> factories =
            Collections.synchronizedMap(new EnumMap<>(BackendKind.class));

    public DriverRegistry register(BackendKind kind, NodeDriverFactory factory) {
        NodeDriverFactory previous = factories.put(kind, factory);
        if (previous != null) {
            log.warn("Replaced driver factory for {}", kind);
        } else {
            log.info("Registered driver factory for {}", kind);
        }
        return this;
    }

    public Set<BackendKind> registeredKinds() {
        synchronized (factories) {
            return Set.copyOf(factories.keySet());
        }
    }

    /**
     * @throws DriverException if no factory is registered for the node's kind
     */
    public NodeDriver newDriver(Node node, TransportRegistry transports) {
        NodeDriverFactory factory = factories.get(node.kind());
        if (factory == null) {
            throw new DriverException("No driver registered for backend kind " + node.kind());
        }
        return factory.create(node, transports);
    }
}
