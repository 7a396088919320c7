package provisio.coordinator.model;

public enum InstanceKind {
    CONTAINER,
    VM
}
