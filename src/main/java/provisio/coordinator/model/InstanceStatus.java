package provisio.coordinator.model;

public enum InstanceStatus {
    CREATING,
    RUNNING,
    STOPPED,
    DELETING,
    DELETED,
    FAILED
}
