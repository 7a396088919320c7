package provisio.coordinator.model;

/**
 * Backend software a node runs. Each kind is served by its own driver factory.
 */
public enum BackendKind {
    DOCKER,
    LXD,
    INCUS,
    PROXMOX
}
