package provisio.coordinator.model;

/**
 * Resource footprint of an instance, reservation or request.
 * Memory and disk are in megabytes, bandwidth in Mbps.
 */
public record Resources(int cpu, long memoryMb, long diskMb, int bandwidthMbps) {

    public static final Resources NONE = new Resources(0, 0, 0, 0);

    public Resources {
        if (cpu < 0 || memoryMb < 0 || diskMb < 0 || bandwidthMbps < 0) {
            throw new IllegalArgumentException("resource amounts must not be negative");
        }
    }

    public static Resources of(int cpu, long memoryMb, long diskMb) {
        return new Resources(cpu, memoryMb, diskMb, 0);
    }

    public Resources plus(Resources other) {
        return new Resources(
                cpu + other.cpu,
                memoryMb + other.memoryMb,
                diskMb + other.diskMb,
                bandwidthMbps + other.bandwidthMbps);
    }

    public boolean isEmpty() {
        return cpu == 0 && memoryMb == 0 && diskMb == 0 && bandwidthMbps == 0;
    }

    @Override
    public String toString() {
        return "Resources{cpu=" + cpu + ", memoryMb=" + memoryMb + ", diskMb=" + diskMb
                + ", bandwidthMbps=" + bandwidthMbps + "}";
    }
}
