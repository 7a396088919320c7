package provisio.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one requested lifecycle operation against a node.
 * Tasks are created only by admission and move PENDING → RUNNING → terminal.
 */
public final class Task {
    private final String id;
    private final TaskKind kind;
    private final TaskStatus status;
    private final int progress;
    private final String statusMessage;
    private final String errorMessage;
    private final String cancelReason;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final String userId;
    private final String nodeId;
    private final String instanceId; // null until a CREATE completes
    private final InstanceKind instanceKind;
    private final String payload; // opaque JSON for the driver
    private final int timeoutSeconds;
    private final int estimatedDurationSeconds;
    private final boolean cancellable;
    private final Resources footprint;
    private final String sessionId; // reservation session, null when committed at admission
    private final boolean allocationCommitted;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.statusMessage = builder.statusMessage;
        this.errorMessage = builder.errorMessage;
        this.cancelReason = builder.cancelReason;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.userId = Objects.requireNonNull(builder.userId, "userId is required");
        this.nodeId = Objects.requireNonNull(builder.nodeId, "nodeId is required");
        this.instanceId = builder.instanceId;
        this.instanceKind = builder.instanceKind != null ? builder.instanceKind : InstanceKind.CONTAINER;
        this.payload = builder.payload != null ? builder.payload : "{}";
        this.timeoutSeconds = builder.timeoutSeconds;
        this.estimatedDurationSeconds = builder.estimatedDurationSeconds;
        this.cancellable = builder.cancellable;
        this.footprint = builder.footprint != null ? builder.footprint : Resources.NONE;
        this.sessionId = builder.sessionId;
        this.allocationCommitted = builder.allocationCommitted;
    }

    // Getters
    public String id() {
        return id;
    }

    public TaskKind kind() {
        return kind;
    }

    public TaskStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public String statusMessage() {
        return statusMessage;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String cancelReason() {
        return cancelReason;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public String userId() {
        return userId;
    }

    public String nodeId() {
        return nodeId;
    }

    public String instanceId() {
        return instanceId;
    }

    public InstanceKind instanceKind() {
        return instanceKind;
    }

    public String payload() {
        return payload;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public int estimatedDurationSeconds() {
        return estimatedDurationSeconds;
    }

    public boolean cancellable() {
        return cancellable;
    }

    public Resources footprint() {
        return footprint;
    }

    public String sessionId() {
        return sessionId;
    }

    public boolean allocationCommitted() {
        return allocationCommitted;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Deadline after which a RUNNING task is swept as timed out. */
    public Instant deadline() {
        if (startedAt == null) {
            return null;
        }
        return startedAt.plusSeconds(timeoutSeconds);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .status(status)
                .progress(progress)
                .statusMessage(statusMessage)
                .errorMessage(errorMessage)
                .cancelReason(cancelReason)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .userId(userId)
                .nodeId(nodeId)
                .instanceId(instanceId)
                .instanceKind(instanceKind)
                .payload(payload)
                .timeoutSeconds(timeoutSeconds)
                .estimatedDurationSeconds(estimatedDurationSeconds)
                .cancellable(cancellable)
                .footprint(footprint)
                .sessionId(sessionId)
                .allocationCommitted(allocationCommitted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskKind kind;
        private TaskStatus status = TaskStatus.PENDING;
        private int progress;
        private String statusMessage;
        private String errorMessage;
        private String cancelReason;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private String userId;
        private String nodeId;
        private String instanceId;
        private InstanceKind instanceKind;
        private String payload;
        private int timeoutSeconds;
        private int estimatedDurationSeconds;
        private boolean cancellable = true;
        private Resources footprint;
        private String sessionId;
        private boolean allocationCommitted;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder statusMessage(String statusMessage) {
            this.statusMessage = statusMessage;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder cancelReason(String cancelReason) {
            this.cancelReason = cancelReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder instanceKind(InstanceKind instanceKind) {
            this.instanceKind = instanceKind;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder estimatedDurationSeconds(int estimatedDurationSeconds) {
            this.estimatedDurationSeconds = estimatedDurationSeconds;
            return this;
        }

        public Builder cancellable(boolean cancellable) {
            this.cancellable = cancellable;
            return this;
        }

        public Builder footprint(Resources footprint) {
            this.footprint = footprint;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder allocationCommitted(boolean allocationCommitted) {
            this.allocationCommitted = allocationCommitted;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', kind=" + kind + ", status=" + status + ", nodeId='" + nodeId + "'}";
    }
}
