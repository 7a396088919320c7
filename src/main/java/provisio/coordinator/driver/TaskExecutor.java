package provisio.coordinator.driver;

import provisio.coordinator.model.Node;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskOutcome;
import provisio.coordinator.repository.NodeRepository;
import provisio.coordinator.service.TaskNotFoundException;
import provisio.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs started tasks against their node's driver on a worker pool and
 * reports the result back to the task ledger.
 *
 * <p>Driver calls are never interrupted. If the task was cancelled or timed
 * out while the call was in flight, the ledger ignores the late result.
 */
public class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final NodeRepository nodes;
    private final NodeConnectionCache connections;
    private final TaskService taskService;
    private final ExecutorService pool;
    private final AtomicInteger inFlight = new AtomicInteger();

    public TaskExecutor(NodeRepository nodes, NodeConnectionCache connections, TaskService taskService,
            int threads) {
        this.nodes = nodes;
        this.connections = connections;
        this.taskService = taskService;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "provisio-executor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Queue a RUNNING task for execution. */
    public void submit(Task task) {
        inFlight.incrementAndGet();
        pool.execute(() -> {
            try {
                execute(task);
            } finally {
                inFlight.decrementAndGet();
            }
        });
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Run one task synchronously on the calling thread.
     */
    public void execute(Task task) {
        String taskId = task.id();
        try {
            Optional<Node> node = nodes.findById(task.nodeId());
            if (node.isEmpty()) {
                report(taskId, taskService.failTask(taskId, "Node not found: " + task.nodeId()));
                return;
            }

            NodeDriver driver = connections.getOrCreate(node.get());
            ProgressListener progress = (percent, message) -> taskService.updateProgress(taskId, percent, message);
            String createdName = null;

            switch (task.kind()) {
                case CREATE -> createdName = driver.create(task, progress);
                case START -> driver.start(task, progress);
                case STOP -> driver.stop(task, progress);
                case RESTART -> driver.restart(task, progress);
                case DELETE -> driver.delete(task, progress);
                case RESET -> driver.reset(task, progress);
                case RESET_PASSWORD -> driver.resetPassword(task, progress);
            }

            report(taskId, taskService.completeTask(taskId, createdName));
        } catch (DriverException e) {
            log.warn("Driver failure for task {} on node {}: {}", taskId, task.nodeId(), e.getMessage());
            failQuietly(taskId, e.getMessage());
        } catch (TaskNotFoundException e) {
            log.warn("Task {} disappeared while executing", taskId);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing task {}", taskId, e);
            failQuietly(taskId, "Unexpected error: " + e.getMessage());
        }
    }

    private void failQuietly(String taskId, String message) {
        try {
            report(taskId, taskService.failTask(taskId, message));
        } catch (RuntimeException e) {
            log.error("Could not record failure of task {}", taskId, e);
        }
    }

    private void report(String taskId, TaskOutcome outcome) {
        if (outcome == TaskOutcome.ALREADY_TERMINAL) {
            log.info("Result for task {} arrived after it finished, ignored", taskId);
        }
    }

    /**
     * Stop accepting work and wait briefly for in-flight driver calls.
     */
    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Executor stopped with {} tasks still in flight", inFlight.get());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
