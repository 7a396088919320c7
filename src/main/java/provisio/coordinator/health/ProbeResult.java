package provisio.coordinator.health;

import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.Reachability;

/**
 * Reachability of each access method from one probe.
 * {@code api} is {@link Reachability#UNKNOWN} when the node has no API access method.
 */
public record ProbeResult(Reachability ssh, Reachability api) {

    public static ProbeResult sshOnly(Reachability ssh) {
        return new ProbeResult(ssh, Reachability.UNKNOWN);
    }

    /** Aggregate status over the methods that were actually probed. */
    public NodeStatus status() {
        boolean sshUp = ssh == Reachability.ONLINE;
        if (api == Reachability.UNKNOWN) {
            return sshUp ? NodeStatus.ACTIVE : NodeStatus.INACTIVE;
        }
        boolean apiUp = api == Reachability.ONLINE;
        if (sshUp && apiUp) {
            return NodeStatus.ACTIVE;
        }
        if (sshUp || apiUp) {
            return NodeStatus.PARTIAL;
        }
        return NodeStatus.INACTIVE;
    }
}
