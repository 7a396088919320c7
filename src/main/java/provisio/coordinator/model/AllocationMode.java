package provisio.coordinator.model;

/**
 * How an admitted task holds the resources it needs.
 */
public enum AllocationMode {
    /** Insert a time-bounded reservation, consumed when the operation commits */
    HOLD,
    /** Commit the allocation to the node counters at admission time */
    COMMIT_NOW
}
