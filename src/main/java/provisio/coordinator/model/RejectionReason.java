package provisio.coordinator.model;

/**
 * Typed reason an admission request was refused.
 */
public enum RejectionReason {
    QUOTA,
    CAPACITY
}
