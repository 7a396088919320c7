package provisio.coordinator.model;

/**
 * Per-tier resource ceiling. A value of 0 means the dimension is not limited.
 */
public record LevelLimit(int maxInstances, int maxCpu, long maxMemoryMb, long maxDiskMb, int maxBandwidthMbps) {

    public static final LevelLimit UNLIMITED = new LevelLimit(0, 0, 0, 0, 0);

    /**
     * Effective ceiling when two limits apply: the stricter value per dimension,
     * where an unlimited (0) side never wins over a limited one.
     */
    public LevelLimit min(LevelLimit other) {
        if (other == null) {
            return this;
        }
        return new LevelLimit(
                (int) stricter(maxInstances, other.maxInstances),
                (int) stricter(maxCpu, other.maxCpu),
                stricter(maxMemoryMb, other.maxMemoryMb),
                stricter(maxDiskMb, other.maxDiskMb),
                (int) stricter(maxBandwidthMbps, other.maxBandwidthMbps));
    }

    private static long stricter(long a, long b) {
        if (a <= 0) {
            return b;
        }
        if (b <= 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
