package provisio.coordinator.model;

/**
 * Reachability of a single access method (SSH or API).
 */
public enum Reachability {
    ONLINE,
    OFFLINE,
    UNKNOWN
}
