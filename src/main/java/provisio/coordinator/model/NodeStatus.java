package provisio.coordinator.model;

/**
 * Aggregate reachability of a node over all of its access methods.
 */
public enum NodeStatus {
    /** Every configured access method answered */
    ACTIVE,
    /** Some access methods answered */
    PARTIAL,
    /** No access method answered */
    INACTIVE
}
