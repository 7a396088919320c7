package provisio.coordinator.repository;

import provisio.coordinator.model.Instance;
import provisio.coordinator.model.InstanceStatus;
import provisio.coordinator.model.Usage;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for provisioned instances.
 */
public interface InstanceRepository {

    void save(Instance instance);

    Optional<Instance> findById(String instanceId);

    List<Instance> findByUser(String userId);

    boolean updateStatus(String instanceId, InstanceStatus status);

    /** Sum of the user's instances that are not DELETED. */
    Usage sumActiveForUser(String userId);
}
