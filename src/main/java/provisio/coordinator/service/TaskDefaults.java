package provisio.coordinator.service;

import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.TaskKind;

/**
 * Per-kind timeout and duration estimates, in seconds.
 */
public final class TaskDefaults {

    private TaskDefaults() {
    }

    public static int timeoutSeconds(TaskKind kind) {
        return switch (kind) {
            case CREATE -> 1800;
            case START, STOP -> 300;
            case RESTART, DELETE, RESET_PASSWORD -> 600;
            case RESET -> 1200;
        };
    }

    public static int estimatedDurationSeconds(TaskKind kind, InstanceKind instanceKind) {
        boolean vm = instanceKind == InstanceKind.VM;
        return switch (kind) {
            case CREATE -> vm ? 300 : 180;
            case RESET -> vm ? 450 : 270;
            case START -> vm ? 90 : 30;
            case STOP -> vm ? 60 : 30;
            case RESTART -> vm ? 150 : 60;
            case DELETE -> 60;
            case RESET_PASSWORD -> 30;
        };
    }

    /** Non-positive requested timeouts fall back to the kind's default. */
    public static int resolveTimeout(TaskKind kind, int requestedSeconds) {
        return requestedSeconds > 0 ? requestedSeconds : timeoutSeconds(kind);
    }
}
