package provisio.coordinator.core;

import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process event bus for task and node-health changes.
 * A failing listener is logged and never affects the publisher or other listeners.
 */
public final class CoordinatorBus {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorBus.class);

    /** Health status change of a node. */
    public record NodeHealthChange(String nodeId, NodeStatus previous, NodeStatus current, boolean allowClaim) {
    }

    private final CopyOnWriteArrayList<Consumer<Task>> taskFinished = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Runnable> tasksChanged = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Consumer<NodeHealthChange>> nodeHealth = new CopyOnWriteArrayList<>();

    public void onTaskFinished(Consumer<Task> listener) {
        taskFinished.add(listener);
    }

    public void onTasksChanged(Runnable listener) {
        tasksChanged.add(listener);
    }

    public void onNodeHealthChanged(Consumer<NodeHealthChange> listener) {
        nodeHealth.add(listener);
    }

    public void fireTaskFinished(Task task) {
        for (var l : taskFinished) {
            try {
                l.accept(task);
            } catch (Exception e) {
                log.warn("Task-finished listener failed for task {}", task.id(), e);
            }
        }
    }

    public void fireTasksChanged() {
        for (var l : tasksChanged) {
            try {
                l.run();
            } catch (Exception e) {
                log.warn("Tasks-changed listener failed", e);
            }
        }
    }

    public void fireNodeHealthChanged(NodeHealthChange change) {
        for (var l : nodeHealth) {
            try {
                l.accept(change);
            } catch (Exception e) {
                log.warn("Node-health listener failed for node {}", change.nodeId(), e);
            }
        }
    }
}
