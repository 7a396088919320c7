package provisio.coordinator.model;

import java.time.Instant;

/**
 * A provisioned container or VM. Non-deleted instances count towards
 * user quota and node committed counters.
 */
public record Instance(
        String id,
        String name,
        String userId,
        String nodeId,
        InstanceKind kind,
        InstanceStatus status,
        Resources footprint,
        Instant createdAt
) {
    public Instance withStatus(InstanceStatus newStatus) {
        return new Instance(id, name, userId, nodeId, kind, newStatus, footprint, createdAt);
    }
}
