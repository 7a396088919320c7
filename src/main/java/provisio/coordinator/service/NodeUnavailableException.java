package provisio.coordinator.service;

import provisio.coordinator.core.CoordinatorException;

/**
 * Node is missing, frozen, expired, not claimable or unreachable.
 */
public class NodeUnavailableException extends CoordinatorException {

    private final String nodeId;

    public NodeUnavailableException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
