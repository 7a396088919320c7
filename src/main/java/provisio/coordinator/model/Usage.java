package provisio.coordinator.model;

/**
 * Aggregated allocation: a resource sum plus instance counts per kind.
 */
public record Usage(Resources resources, int containers, int vms) {

    public static final Usage NONE = new Usage(Resources.NONE, 0, 0);

    public int instances() {
        return containers + vms;
    }

    public Usage plus(Usage other) {
        return new Usage(resources.plus(other.resources), containers + other.containers, vms + other.vms);
    }

    /** Usage of a single instance of the given kind. */
    public static Usage single(InstanceKind kind, Resources footprint) {
        return kind == InstanceKind.VM
                ? new Usage(footprint, 0, 1)
                : new Usage(footprint, 1, 0);
    }
}
