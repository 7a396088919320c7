package provisio.coordinator.service;

import provisio.coordinator.core.CoordinatorBus;
import provisio.coordinator.model.Instance;
import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.InstanceStatus;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskKind;
import provisio.coordinator.model.TaskOutcome;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.repository.InstanceRepository;
import provisio.coordinator.repository.NodeRepository;
import provisio.coordinator.repository.TaskRepository;
import provisio.coordinator.repository.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for the task ledger.
 * Owns every task state transition and the resource reconciliation that
 * goes with it; each transition and its reconciliation share one transaction.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private record Transition(Task task, boolean applied) {
    }

    private final TxRunner tx;
    private final TaskRepository tasks;
    private final NodeRepository nodes;
    private final InstanceRepository instances;
    private final ReservationService reservations;
    private final AdmissionService admission;
    private final CoordinatorBus bus;
    private final Clock clock;

    public TaskService(TxRunner tx, TaskRepository tasks, NodeRepository nodes, InstanceRepository instances,
            ReservationService reservations, AdmissionService admission, CoordinatorBus bus, Clock clock) {
        this.tx = tx;
        this.tasks = tasks;
        this.nodes = nodes;
        this.instances = instances;
        this.reservations = reservations;
        this.admission = admission;
        this.bus = bus;
        this.clock = clock;
    }

    // ========== Creation ==========

    /**
     * Create a task for an existing instance (or a CREATE without footprint).
     * The instance kind is taken from the instance when it is known.
     */
    public Task createTask(String userId, String nodeId, String instanceId, TaskKind kind, String payload,
            int timeoutSeconds) {
        InstanceKind instanceKind = instanceId == null
                ? InstanceKind.CONTAINER
                : instances.findById(instanceId).map(Instance::kind).orElse(InstanceKind.CONTAINER);
        return createTask(AdmissionRequest.builder()
                .userId(userId)
                .nodeId(nodeId)
                .instanceId(instanceId)
                .kind(kind)
                .instanceKind(instanceKind)
                .payload(payload)
                .timeoutSeconds(timeoutSeconds)
                .build());
    }

    /**
     * Admit and record a task, then ask the dispatcher for an immediate drain.
     *
     * @throws AdmissionRejectedException on quota or capacity failure
     * @throws NodeUnavailableException   if the node cannot take the task
     */
    public Task createTask(AdmissionRequest request) {
        if (request.kind() != TaskKind.CREATE && request.instanceId() == null) {
            throw new IllegalArgumentException("Task kind " + request.kind().code() + " requires an instance id");
        }
        Task task = admission.admit(request);
        bus.fireTasksChanged();
        return task;
    }

    // ========== Dispatch ==========

    /**
     * Promote a PENDING task to RUNNING if its node has a free slot.
     * The node row is locked so concurrent starts on one node serialize.
     *
     * @return the started task, or empty if the node is full or the task is no longer pending
     */
    public Optional<Task> tryStart(String taskId) {
        Optional<Task> started = tx.required(() -> {
            Optional<Task> current = tasks.findById(taskId);
            if (current.isEmpty() || current.get().status() != TaskStatus.PENDING) {
                return Optional.<Task>empty();
            }
            Optional<Node> node = nodes.lockById(current.get().nodeId());
            if (node.isEmpty()) {
                return Optional.<Task>empty();
            }
            int running = tasks.countRunningOnNode(node.get().id());
            if (running >= node.get().maxRunningTasks()) {
                log.debug("Node {} full ({} running), task {} stays pending", node.get().id(), running, taskId);
                return Optional.<Task>empty();
            }
            if (!tasks.markRunning(taskId, clock.instant())) {
                return Optional.<Task>empty();
            }
            return tasks.findById(taskId);
        });
        started.ifPresent(t -> log.info("Started task {} ({}) on node {}", t.id(), t.kind().code(), t.nodeId()));
        return started;
    }

    // ========== Cancellation ==========

    /**
     * Administrative cancel. Idempotent: a terminal task is returned unchanged.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public Task cancelTask(String taskId, String reason) {
        String why = reason == null || reason.isBlank() ? "Cancelled by administrator" : reason;
        Transition result = tx.required(() -> {
            Task task = tasks.lockById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            if (task.isTerminal()) {
                return new Transition(task, false);
            }
            tasks.markCancelled(taskId, why, clock.instant());
            releaseAllocation(task);
            return new Transition(tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId)), true);
        });
        if (result.applied()) {
            log.info("Cancelled task {}: {}", taskId, why);
            finished(result.task());
        } else {
            log.debug("Task {} already {}, cancel ignored", taskId, result.task().status());
        }
        return result.task();
    }

    /**
     * Cancel on behalf of the owning user.
     *
     * @throws TaskNotFoundException       if the task does not exist
     * @throws TaskNotCancellableException for a foreign task, a non-cancellable
     *                                     task or a task that already finished
     */
    public Task cancelByUser(String taskId, String userId) {
        Task task = tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (!task.userId().equals(userId)) {
            throw new TaskNotCancellableException("Task " + taskId + " does not belong to user " + userId);
        }
        if (!task.cancellable()) {
            throw new TaskNotCancellableException("Task " + taskId + " cannot be cancelled by its owner");
        }
        if (task.isTerminal()) {
            throw new TaskNotCancellableException("Task " + taskId + " is already " + task.status());
        }
        return cancelTask(taskId, "Cancelled by user");
    }

    // ========== Progress and results ==========

    /** Record progress; ignored unless the task is RUNNING. */
    public boolean updateProgress(String taskId, int percent, String message) {
        int clamped = Math.max(0, Math.min(100, percent));
        return tasks.updateProgress(taskId, clamped, message);
    }

    /**
     * Record a successful driver result and reconcile resources.
     *
     * @param createdInstanceName name reported by the driver for CREATE, may be null
     * @throws TaskNotFoundException if the task does not exist
     */
    public TaskOutcome completeTask(String taskId, String createdInstanceName) {
        TaskOutcome outcome = tx.required(() -> {
            Task task = tasks.lockById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            if (task.isTerminal()) {
                return TaskOutcome.ALREADY_TERMINAL;
            }
            if (task.status() != TaskStatus.RUNNING) {
                return TaskOutcome.WRONG_STATE;
            }
            Instant now = clock.instant();
            String instanceId = task.instanceId();

            switch (task.kind()) {
                case CREATE -> {
                    if (task.sessionId() != null && !task.allocationCommitted()) {
                        try {
                            reservations.consumeBySession(task.sessionId());
                        } catch (ReservationExpiredException e) {
                            tasks.markFailed(taskId, e.getMessage(), now);
                            return TaskOutcome.RESERVATION_EXPIRED;
                        }
                        nodes.commit(task.nodeId(), task.instanceKind(), task.footprint());
                    }
                    instanceId = UUID.randomUUID().toString();
                    instances.save(new Instance(
                            instanceId,
                            instanceName(task, createdInstanceName),
                            task.userId(),
                            task.nodeId(),
                            task.instanceKind(),
                            InstanceStatus.RUNNING,
                            task.footprint(),
                            now));
                }
                case DELETE -> releaseDeletedInstance(task);
                case START, RESTART, RESET -> setInstanceStatus(task, InstanceStatus.RUNNING);
                case STOP -> setInstanceStatus(task, InstanceStatus.STOPPED);
                case RESET_PASSWORD -> {
                    // no instance state change
                }
            }
            tasks.markCompleted(taskId, instanceId, now);
            return TaskOutcome.APPLIED;
        });

        switch (outcome) {
            case APPLIED -> log.info("Task {} completed", taskId);
            case RESERVATION_EXPIRED -> log.warn("Task {} failed: reservation expired before completion", taskId);
            case ALREADY_TERMINAL -> log.info("Ignoring late result for finished task {}", taskId);
            case WRONG_STATE -> log.warn("Ignoring result for task {} that never started", taskId);
        }
        if (outcome == TaskOutcome.APPLIED || outcome == TaskOutcome.RESERVATION_EXPIRED) {
            tasks.findById(taskId).ifPresent(this::finished);
        }
        return outcome;
    }

    /**
     * Record a driver failure; held or committed resources are released.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public TaskOutcome failTask(String taskId, String message) {
        TaskOutcome outcome = tx.required(() -> {
            Task task = tasks.lockById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            if (task.isTerminal()) {
                return TaskOutcome.ALREADY_TERMINAL;
            }
            if (task.status() != TaskStatus.RUNNING) {
                return TaskOutcome.WRONG_STATE;
            }
            tasks.markFailed(taskId, message, clock.instant());
            releaseAllocation(task);
            return TaskOutcome.APPLIED;
        });

        if (outcome == TaskOutcome.APPLIED) {
            log.warn("Task {} failed: {}", taskId, message);
            tasks.findById(taskId).ifPresent(this::finished);
        } else {
            log.info("Ignoring failure report for task {} ({})", taskId, outcome);
        }
        return outcome;
    }

    /**
     * Fail a RUNNING task whose deadline passed and release what it holds,
     * reserved or committed, exactly as a failure does. Existing instances
     * are left alone; a late result from the backend is ignored.
     *
     * @return true if the task was timed out by this call
     */
    public boolean timeOut(String taskId) {
        Optional<Task> timedOut = tx.required(() -> {
            Optional<Task> current = tasks.lockById(taskId);
            if (current.isEmpty() || current.get().status() != TaskStatus.RUNNING) {
                return Optional.<Task>empty();
            }
            Task task = current.get();
            if (!tasks.markFailed(taskId, "Task timed out after " + task.timeoutSeconds() + "s", clock.instant())) {
                return Optional.<Task>empty();
            }
            releaseAllocation(task);
            return tasks.findById(taskId);
        });
        timedOut.ifPresent(t -> {
            log.warn("Task {} ({}) on node {} timed out after {}s", t.id(), t.kind().code(), t.nodeId(),
                    t.timeoutSeconds());
            finished(t);
        });
        return timedOut.isPresent();
    }

    // ========== Queries ==========

    public Optional<Task> findById(String taskId) {
        return tasks.findById(taskId);
    }

    public List<Task> findByUser(String userId) {
        return tasks.findByUser(userId);
    }

    public List<Task> findByNode(String nodeId) {
        return tasks.findByNode(nodeId);
    }

    public Map<TaskStatus, Integer> statusCounts() {
        return tasks.countByStatus();
    }

    /**
     * 0-based position among the node's PENDING tasks, -1 if the task is not pending.
     */
    public int queuePosition(String taskId) {
        Task task = tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (task.status() != TaskStatus.PENDING) {
            return -1;
        }
        List<Task> pending = tasks.findPendingByNode(task.nodeId());
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).id().equals(taskId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Rough wait before the task finishes: remaining time of running tasks and
     * estimates of pending tasks ahead of it, spread over the node's slots.
     */
    public long estimatedWaitSeconds(String taskId) {
        Task task = tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        Instant now = clock.instant();
        if (task.isTerminal()) {
            return 0;
        }
        if (task.status() == TaskStatus.RUNNING) {
            return remaining(task, now);
        }

        long ahead = 0;
        for (Task running : tasks.findByNode(task.nodeId())) {
            if (running.status() == TaskStatus.RUNNING) {
                ahead += remaining(running, now);
            }
        }
        for (Task pending : tasks.findPendingByNode(task.nodeId())) {
            if (pending.id().equals(taskId)) {
                break;
            }
            ahead += pending.estimatedDurationSeconds();
        }
        int slots = nodes.findById(task.nodeId()).map(Node::maxRunningTasks).orElse(1);
        return ahead / slots + task.estimatedDurationSeconds();
    }

    // ========== Internals ==========

    /**
     * Release whatever the task holds. Committed allocations are released only
     * when {@code includeCommitted} is set.
     */
    private void releaseAllocation(Task task) {
        if (task.sessionId() != null) {
            reservations.release(task.sessionId());
        }
        if (task.allocationCommitted() && task.kind() == TaskKind.CREATE) {
            nodes.release(task.nodeId(), task.instanceKind(), task.footprint());
        }
    }

    private void releaseDeletedInstance(Task task) {
        if (task.instanceId() == null) {
            return;
        }
        Optional<Instance> instance = instances.findById(task.instanceId());
        if (instance.isEmpty()) {
            log.warn("Delete task {} refers to unknown instance {}", task.id(), task.instanceId());
            return;
        }
        Instance i = instance.get();
        if (i.status() == InstanceStatus.DELETED) {
            return;
        }
        instances.updateStatus(i.id(), InstanceStatus.DELETED);
        nodes.release(i.nodeId(), i.kind(), i.footprint());
    }

    private void setInstanceStatus(Task task, InstanceStatus status) {
        if (task.instanceId() != null) {
            instances.updateStatus(task.instanceId(), status);
        }
    }

    private static String instanceName(Task task, String reported) {
        if (reported != null && !reported.isBlank()) {
            return reported;
        }
        String requested = TaskPayloads.instanceName(task.payload());
        return requested != null ? requested : "instance-" + task.id().substring(0, 8);
    }

    private static long remaining(Task task, Instant now) {
        if (task.startedAt() == null) {
            return task.estimatedDurationSeconds();
        }
        long elapsed = Duration.between(task.startedAt(), now).getSeconds();
        return Math.max(0, task.estimatedDurationSeconds() - elapsed);
    }

    private void finished(Task task) {
        bus.fireTaskFinished(task);
        bus.fireTasksChanged();
    }
}
