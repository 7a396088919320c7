package provisio.coordinator.driver;

import provisio.coordinator.model.Node;

/**
 * Builds an unconnected driver for a node of one backend kind.
 */
@FunctionalInterface
public interface NodeDriverFactory {

    NodeDriver create(Node node, TransportRegistry transports);
}
