package provisio.coordinator.service;

import provisio.coordinator.core.CoordinatorException;

public class TaskNotFoundException extends CoordinatorException {

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
    }
}
