package provisio.coordinator.service;

import provisio.coordinator.core.CoordinatorException;

/**
 * Raised when a user may not cancel a task: foreign task, non-cancellable
 * kind or a state past the point of cancellation.
 */
public class TaskNotCancellableException extends CoordinatorException {

    public TaskNotCancellableException(String message) {
        super(message);
    }
}
