package provisio.coordinator.service;

import provisio.coordinator.model.AllocationMode;
import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.Resources;
import provisio.coordinator.model.TaskKind;

import java.util.Objects;

/**
 * Everything the admission gate needs to decide on and record one task.
 * Only CREATE requests carry a footprint; it is ignored for other kinds.
 */
public record AdmissionRequest(
        String userId,
        String nodeId,
        String instanceId,
        TaskKind kind,
        InstanceKind instanceKind,
        Resources footprint,
        String payload,
        int timeoutSeconds,
        int estimatedDurationSeconds,
        boolean cancellable,
        AllocationMode allocationMode, // null = configured default
        String sessionId // null or blank = generated
) {
    public AdmissionRequest {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(kind, "kind is required");
        if (instanceKind == null) {
            instanceKind = InstanceKind.CONTAINER;
        }
        if (footprint == null || !kind.consumesResources()) {
            footprint = Resources.NONE;
        }
    }

    /** Footprint charged against quota and capacity. */
    public Resources chargedFootprint() {
        return kind.consumesResources() ? footprint : Resources.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String userId;
        private String nodeId;
        private String instanceId;
        private TaskKind kind;
        private InstanceKind instanceKind = InstanceKind.CONTAINER;
        private Resources footprint = Resources.NONE;
        private String payload;
        private int timeoutSeconds;
        private int estimatedDurationSeconds;
        private boolean cancellable = true;
        private AllocationMode allocationMode;
        private String sessionId;

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

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder instanceKind(InstanceKind instanceKind) {
            this.instanceKind = instanceKind;
            return this;
        }

        public Builder footprint(Resources footprint) {
            this.footprint = footprint;
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

        public Builder allocationMode(AllocationMode allocationMode) {
            this.allocationMode = allocationMode;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public AdmissionRequest build() {
            return new AdmissionRequest(userId, nodeId, instanceId, kind, instanceKind, footprint, payload,
                    timeoutSeconds, estimatedDurationSeconds, cancellable, allocationMode, sessionId);
        }
    }
}
