package provisio.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a backend node (container engine or hypervisor host).
 * Capacity fields are administrator-owned, committed counters are owned by the
 * admission and reconciliation paths, health fields by the health monitor.
 */
public final class Node {
    private final String id;
    private final String name;
    private final BackendKind kind;
    private final String host;
    private final int sshPort;
    private final int apiPort; // 0 when the node has no API access method
    private final String username;
    private final String credential;

    private final int cpuCapacity;
    private final long memoryCapacityMb;
    private final long diskCapacityMb;
    private final int maxInstances;
    private final int maxContainers;
    private final int maxVms;

    private final int usedCpu;
    private final long usedMemoryMb;
    private final long usedDiskMb;
    private final int containerCount;
    private final int vmCount;

    private final boolean allowConcurrentTasks;
    private final int maxConcurrentTasks;

    private final boolean allowClaim;
    private final boolean frozen;
    private final Instant expiresAt;

    private final NodeStatus status;
    private final Reachability sshStatus;
    private final Reachability apiStatus;
    private final Instant lastCheckedAt;

    private final String levelLimits; // JSON override keyed by level, may be null
    private final Instant createdAt;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.host = builder.host;
        this.sshPort = builder.sshPort;
        this.apiPort = builder.apiPort;
        this.username = builder.username;
        this.credential = builder.credential;
        this.cpuCapacity = builder.cpuCapacity;
        this.memoryCapacityMb = builder.memoryCapacityMb;
        this.diskCapacityMb = builder.diskCapacityMb;
        this.maxInstances = builder.maxInstances;
        this.maxContainers = builder.maxContainers;
        this.maxVms = builder.maxVms;
        this.usedCpu = builder.usedCpu;
        this.usedMemoryMb = builder.usedMemoryMb;
        this.usedDiskMb = builder.usedDiskMb;
        this.containerCount = builder.containerCount;
        this.vmCount = builder.vmCount;
        this.allowConcurrentTasks = builder.allowConcurrentTasks;
        this.maxConcurrentTasks = builder.maxConcurrentTasks;
        this.allowClaim = builder.allowClaim;
        this.frozen = builder.frozen;
        this.expiresAt = builder.expiresAt;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.sshStatus = builder.sshStatus;
        this.apiStatus = builder.apiStatus;
        this.lastCheckedAt = builder.lastCheckedAt;
        this.levelLimits = builder.levelLimits;
        this.createdAt = builder.createdAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public BackendKind kind() {
        return kind;
    }

    public String host() {
        return host;
    }

    public int sshPort() {
        return sshPort;
    }

    public int apiPort() {
        return apiPort;
    }

    public String username() {
        return username;
    }

    public String credential() {
        return credential;
    }

    public int cpuCapacity() {
        return cpuCapacity;
    }

    public long memoryCapacityMb() {
        return memoryCapacityMb;
    }

    public long diskCapacityMb() {
        return diskCapacityMb;
    }

    public int maxInstances() {
        return maxInstances;
    }

    public int maxContainers() {
        return maxContainers;
    }

    public int maxVms() {
        return maxVms;
    }

    public int usedCpu() {
        return usedCpu;
    }

    public long usedMemoryMb() {
        return usedMemoryMb;
    }

    public long usedDiskMb() {
        return usedDiskMb;
    }

    public int containerCount() {
        return containerCount;
    }

    public int vmCount() {
        return vmCount;
    }

    public boolean allowConcurrentTasks() {
        return allowConcurrentTasks;
    }

    public int maxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public boolean allowClaim() {
        return allowClaim;
    }

    public boolean frozen() {
        return frozen;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public NodeStatus status() {
        return status;
    }

    public Reachability sshStatus() {
        return sshStatus;
    }

    public Reachability apiStatus() {
        return apiStatus;
    }

    public Instant lastCheckedAt() {
        return lastCheckedAt;
    }

    public String levelLimits() {
        return levelLimits;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Committed allocation as a footprint (bandwidth is not tracked per node). */
    public Resources committed() {
        return new Resources(usedCpu, usedMemoryMb, usedDiskMb, 0);
    }

    public int instanceCount() {
        return containerCount + vmCount;
    }

    public boolean hasApi() {
        return apiPort > 0;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /** Maximum tasks this node may have RUNNING at once. */
    public int maxRunningTasks() {
        if (!allowConcurrentTasks || maxConcurrentTasks <= 0) {
            return 1;
        }
        return maxConcurrentTasks;
    }

    /** Create a builder from this node (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id).name(name).kind(kind)
                .host(host).sshPort(sshPort).apiPort(apiPort)
                .username(username).credential(credential)
                .cpuCapacity(cpuCapacity).memoryCapacityMb(memoryCapacityMb).diskCapacityMb(diskCapacityMb)
                .maxInstances(maxInstances).maxContainers(maxContainers).maxVms(maxVms)
                .usedCpu(usedCpu).usedMemoryMb(usedMemoryMb).usedDiskMb(usedDiskMb)
                .containerCount(containerCount).vmCount(vmCount)
                .allowConcurrentTasks(allowConcurrentTasks).maxConcurrentTasks(maxConcurrentTasks)
                .allowClaim(allowClaim).frozen(frozen).expiresAt(expiresAt)
                .status(status).sshStatus(sshStatus).apiStatus(apiStatus).lastCheckedAt(lastCheckedAt)
                .levelLimits(levelLimits).createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private BackendKind kind;
        private String host;
        private int sshPort = 22;
        private int apiPort;
        private String username;
        private String credential;
        private int cpuCapacity;
        private long memoryCapacityMb;
        private long diskCapacityMb;
        private int maxInstances;
        private int maxContainers;
        private int maxVms;
        private int usedCpu;
        private long usedMemoryMb;
        private long usedDiskMb;
        private int containerCount;
        private int vmCount;
        private boolean allowConcurrentTasks;
        private int maxConcurrentTasks = 1;
        private boolean allowClaim = true;
        private boolean frozen;
        private Instant expiresAt;
        private NodeStatus status = NodeStatus.ACTIVE;
        private Reachability sshStatus = Reachability.UNKNOWN;
        private Reachability apiStatus = Reachability.UNKNOWN;
        private Instant lastCheckedAt;
        private String levelLimits;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(BackendKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder sshPort(int sshPort) {
            this.sshPort = sshPort;
            return this;
        }

        public Builder apiPort(int apiPort) {
            this.apiPort = apiPort;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder credential(String credential) {
            this.credential = credential;
            return this;
        }

        public Builder cpuCapacity(int cpuCapacity) {
            this.cpuCapacity = cpuCapacity;
            return this;
        }

        public Builder memoryCapacityMb(long memoryCapacityMb) {
            this.memoryCapacityMb = memoryCapacityMb;
            return this;
        }

        public Builder diskCapacityMb(long diskCapacityMb) {
            this.diskCapacityMb = diskCapacityMb;
            return this;
        }

        public Builder maxInstances(int maxInstances) {
            this.maxInstances = maxInstances;
            return this;
        }

        public Builder maxContainers(int maxContainers) {
            this.maxContainers = maxContainers;
            return this;
        }

        public Builder maxVms(int maxVms) {
            this.maxVms = maxVms;
            return this;
        }

        public Builder usedCpu(int usedCpu) {
            this.usedCpu = usedCpu;
            return this;
        }

        public Builder usedMemoryMb(long usedMemoryMb) {
            this.usedMemoryMb = usedMemoryMb;
            return this;
        }

        public Builder usedDiskMb(long usedDiskMb) {
            this.usedDiskMb = usedDiskMb;
            return this;
        }

        public Builder containerCount(int containerCount) {
            this.containerCount = containerCount;
            return this;
        }

        public Builder vmCount(int vmCount) {
            this.vmCount = vmCount;
            return this;
        }

        public Builder allowConcurrentTasks(boolean allowConcurrentTasks) {
            this.allowConcurrentTasks = allowConcurrentTasks;
            return this;
        }

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder allowClaim(boolean allowClaim) {
            this.allowClaim = allowClaim;
            return this;
        }

        public Builder frozen(boolean frozen) {
            this.frozen = frozen;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder status(NodeStatus status) {
            this.status = status;
            return this;
        }

        public Builder sshStatus(Reachability sshStatus) {
            this.sshStatus = sshStatus;
            return this;
        }

        public Builder apiStatus(Reachability apiStatus) {
            this.apiStatus = apiStatus;
            return this;
        }

        public Builder lastCheckedAt(Instant lastCheckedAt) {
            this.lastCheckedAt = lastCheckedAt;
            return this;
        }

        public Builder levelLimits(String levelLimits) {
            this.levelLimits = levelLimits;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Node node))
            return false;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{id='" + id + "', kind=" + kind + ", status=" + status
                + ", allowClaim=" + allowClaim + ", frozen=" + frozen + "}";
    }
}
