package provisio.coordinator.health;

import provisio.coordinator.model.Node;

/**
 * Checks whether a node's access methods answer.
 * Implementations may block; the caller bounds the wait.
 */
@FunctionalInterface
public interface NodeProbe {

    ProbeResult probe(Node node) throws Exception;
}
