package provisio.coordinator.model;

/**
 * Task lifecycle status.
 */
public enum TaskStatus {
    /** Admitted, waiting for a concurrency slot on its node */
    PENDING,
    /** Dispatched to the node's driver */
    RUNNING,
    /** Driver operation finished successfully */
    COMPLETED,
    /** Driver failure, timeout or reconciliation failure */
    FAILED,
    /** Cancelled by an administrator, the owning user or the dispatcher */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
