package provisio.coordinator.scheduler;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskKind;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.repository.NodeRepository;
import provisio.coordinator.repository.TaskRepository;
import provisio.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Moves PENDING tasks to RUNNING and hands them to the executor.
 *
 * <p>A periodic tick and {@link #triggerImmediateDrain()} run the same drain
 * on a single dispatcher thread. Pending tasks are visited oldest first; a
 * task whose node can no longer take it is cancelled with the reason, and a
 * task whose node is at its running limit stays pending.
 */
public class TaskDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final TaskRepository tasks;
    private final NodeRepository nodes;
    private final TaskService taskService;
    private final Consumer<Task> launcher;
    private final Clock clock;
    private final Duration tickInterval;
    private final int batchSize;
    private final ScheduledExecutorService thread;
    private final AtomicBoolean drainRequested = new AtomicBoolean();

    private volatile boolean running = false;

    public TaskDispatcher(TaskRepository tasks, NodeRepository nodes, TaskService taskService,
            Consumer<Task> launcher, CoordinatorConfig config, Clock clock) {
        this.tasks = tasks;
        this.nodes = nodes;
        this.taskService = taskService;
        this.launcher = launcher;
        this.clock = clock;
        this.tickInterval = config.dispatchInterval();
        this.batchSize = config.dispatchBatchSize();
        this.thread = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provisio-dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        long ms = tickInterval.toMillis();
        thread.scheduleWithFixedDelay(this::drainSafely, 0, ms, TimeUnit.MILLISECONDS);
        log.info("Dispatcher started, tick every {}ms", ms);
    }

    /**
     * Ask for a drain as soon as possible without blocking the caller.
     * Requests made while one is already queued are merged into it.
     */
    public void triggerImmediateDrain() {
        if (!running) {
            return;
        }
        if (drainRequested.compareAndSet(false, true)) {
            thread.execute(() -> {
                drainRequested.set(false);
                drainSafely();
            });
        }
    }

    private void drainSafely() {
        try {
            drain();
        } catch (RuntimeException e) {
            log.error("Dispatcher drain failed", e);
        }
    }

    /**
     * One pass over the pending queue.
     *
     * @return number of tasks started
     */
    public synchronized int drain() {
        List<Task> pending = tasks.findPending(batchSize);
        if (pending.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        Map<String, Optional<Node>> nodeById = new HashMap<>();
        Set<String> full = new HashSet<>();
        int started = 0;
        int cancelled = 0;

        for (Task task : pending) {
            try {
                Optional<Node> node = nodeById.computeIfAbsent(task.nodeId(), nodes::findById);
                String blocked = blockingReason(task, node, now);
                if (blocked != null) {
                    taskService.cancelTask(task.id(), blocked);
                    cancelled++;
                    continue;
                }
                if (full.contains(task.nodeId())) {
                    continue;
                }
                Optional<Task> start = taskService.tryStart(task.id());
                if (start.isEmpty()) {
                    if (stillPending(task)) {
                        full.add(task.nodeId());
                    }
                    continue;
                }
                started++;
                launch(start.get());
            } catch (RuntimeException e) {
                log.error("Failed to dispatch task {}", task.id(), e);
            }
        }

        if (started > 0 || cancelled > 0) {
            log.info("Dispatcher: {} started, {} cancelled, {} pending examined", started, cancelled, pending.size());
        }
        return started;
    }

    /** False once the task was cancelled or started elsewhere since the queue was read. */
    private boolean stillPending(Task task) {
        return tasks.findById(task.id()).map(t -> t.status() == TaskStatus.PENDING).orElse(false);
    }

    private void launch(Task task) {
        try {
            launcher.accept(task);
        } catch (RuntimeException e) {
            log.error("Could not hand task {} to the executor", task.id(), e);
            taskService.failTask(task.id(), "Could not dispatch task: " + e.getMessage());
        }
    }

    /**
     * Reason the task can never run on its node, or null if it may start.
     * A node that is not claimable but still reachable keeps running tasks.
     */
    static String blockingReason(Task task, Optional<Node> node, Instant now) {
        if (node.isEmpty()) {
            return "Node not found";
        }
        Node n = node.get();
        if (n.frozen()) {
            return "Node is frozen";
        }
        if (n.isExpired(now)) {
            return "Node has expired";
        }
        if (n.status() == NodeStatus.INACTIVE && task.kind() != TaskKind.DELETE) {
            return "Node is inactive";
        }
        return null;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        running = false;
        thread.shutdownNow();
    }
}
