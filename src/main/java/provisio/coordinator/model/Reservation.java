package provisio.coordinator.model;

import java.time.Instant;

/**
 * A time-boxed hold on node capacity, identified by an opaque session id.
 * Counted against capacity and quota only while unexpired.
 */
public record Reservation(
        String id,
        String sessionId,
        String userId,
        String nodeId,
        InstanceKind instanceKind,
        Resources footprint,
        Instant createdAt,
        Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
