package provisio.coordinator.service;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.model.AllocationMode;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.RejectionReason;
import provisio.coordinator.model.Reservation;
import provisio.coordinator.model.Resources;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskKind;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.model.Usage;
import provisio.coordinator.model.UserAccount;
import provisio.coordinator.repository.NodeRepository;
import provisio.coordinator.repository.TaskRepository;
import provisio.coordinator.repository.TxRunner;
import provisio.coordinator.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Admission gate: validates quota and node capacity and records the
 * admitted task together with its resource hold, all in one transaction.
 * A node at its running limit still admits: the task waits as PENDING until
 * the dispatcher finds a free slot.
 *
 * <p>Row locks are taken in a fixed order (user, then node) and held until
 * commit, so two admissions for the same node or the same user never
 * evaluate against the same snapshot. A rejection writes nothing.
 */
public class AdmissionService {

    private static final Logger log = LoggerFactory.getLogger(AdmissionService.class);

    private final TxRunner tx;
    private final UserRepository users;
    private final NodeRepository nodes;
    private final TaskRepository tasks;
    private final ReservationService reservations;
    private final QuotaService quotaService;
    private final CoordinatorConfig config;
    private final Clock clock;

    public AdmissionService(TxRunner tx, UserRepository users, NodeRepository nodes, TaskRepository tasks,
            ReservationService reservations, QuotaService quotaService, CoordinatorConfig config, Clock clock) {
        this.tx = tx;
        this.users = users;
        this.nodes = nodes;
        this.tasks = tasks;
        this.reservations = reservations;
        this.quotaService = quotaService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Admit a request and persist it as a PENDING task.
     *
     * @throws AdmissionRejectedException on quota or capacity failure
     * @throws NodeUnavailableException   if the node is missing, frozen, expired,
     *                                    not claimable or inactive
     */
    public Task admit(AdmissionRequest request) {
        Task task = tx.required(() -> admitInTx(request));
        log.info("Admitted task {} ({}) for user {} on node {}",
                task.id(), task.kind().code(), task.userId(), task.nodeId());
        return task;
    }

    private Task admitInTx(AdmissionRequest request) {
        Instant now = clock.instant();

        UserAccount user = users.lockById(request.userId())
                .orElseThrow(() -> new AdmissionRejectedException(RejectionReason.QUOTA,
                        "Unknown user: " + request.userId()));
        Node node = nodes.lockById(request.nodeId())
                .orElseThrow(() -> new NodeUnavailableException(request.nodeId(),
                        "Node not found: " + request.nodeId()));

        checkNodeAvailable(node, request.kind(), now);

        Resources footprint = request.chargedFootprint();
        if (request.kind().consumesResources()) {
            Optional<String> quotaViolation = quotaService.check(user, node, request.instanceKind(), footprint, now);
            if (quotaViolation.isPresent()) {
                throw reject(RejectionReason.QUOTA, quotaViolation.get(), request);
            }

            Optional<String> capacityViolation = checkCapacity(node, request, footprint);
            if (capacityViolation.isPresent()) {
                throw reject(RejectionReason.CAPACITY, capacityViolation.get(), request);
            }
        }

        // Pending tasks queue without limit; the running limit is applied when a task starts.
        int running = tasks.countRunningOnNode(node.id());
        int limit = node.maxRunningTasks();
        if (running >= limit) {
            log.info("Node {} has {} of {} task slots in use, {} task waits behind {} pending",
                    node.id(), running, limit, request.kind().code(), tasks.findPendingByNode(node.id()).size());
        }

        AllocationMode mode = request.allocationMode() != null ? request.allocationMode() : config.allocationMode();
        String taskId = UUID.randomUUID().toString();
        String payload = TaskPayloads.normalize(request.payload());
        String sessionId = null;
        boolean committed = false;

        if (request.kind().consumesResources()) {
            if (mode == AllocationMode.HOLD) {
                Reservation reservation = reservations.reserve(user.id(), node.id(), request.sessionId(),
                        request.instanceKind(), footprint, config.reservationTtl());
                sessionId = reservation.sessionId();
                payload = TaskPayloads.withSessionId(payload, sessionId);
            } else {
                nodes.commit(node.id(), request.instanceKind(), footprint);
                committed = true;
            }
        }

        Task task = Task.builder()
                .id(taskId)
                .kind(request.kind())
                .status(TaskStatus.PENDING)
                .statusMessage("Waiting to start")
                .createdAt(now)
                .userId(user.id())
                .nodeId(node.id())
                .instanceId(request.instanceId())
                .instanceKind(request.instanceKind())
                .payload(payload)
                .timeoutSeconds(TaskDefaults.resolveTimeout(request.kind(), request.timeoutSeconds()))
                .estimatedDurationSeconds(request.estimatedDurationSeconds() > 0
                        ? request.estimatedDurationSeconds()
                        : TaskDefaults.estimatedDurationSeconds(request.kind(), request.instanceKind()))
                .cancellable(request.cancellable())
                .footprint(footprint)
                .sessionId(sessionId)
                .allocationCommitted(committed)
                .build();
        tasks.save(task);
        return task;
    }

    private void checkNodeAvailable(Node node, TaskKind kind, Instant now) {
        if (node.frozen()) {
            throw new NodeUnavailableException(node.id(), "Node " + node.id() + " is frozen");
        }
        if (node.isExpired(now)) {
            throw new NodeUnavailableException(node.id(), "Node " + node.id() + " has expired");
        }
        if (kind == TaskKind.CREATE && !node.allowClaim()) {
            throw new NodeUnavailableException(node.id(), "Node " + node.id() + " is not accepting new instances");
        }
        if (kind != TaskKind.DELETE && node.status() == NodeStatus.INACTIVE) {
            throw new NodeUnavailableException(node.id(), "Node " + node.id() + " is inactive");
        }
    }

    /**
     * Committed counters plus unexpired reservations plus the request must fit
     * every enforced (non-zero) capacity dimension.
     */
    private Optional<String> checkCapacity(Node node, AdmissionRequest request, Resources footprint) {
        Usage committed = new Usage(node.committed(), node.containerCount(), node.vmCount());
        Usage after = committed
                .plus(reservations.sumActiveForNode(node.id()))
                .plus(Usage.single(request.instanceKind(), footprint));
        Resources r = after.resources();

        if (node.cpuCapacity() > 0 && r.cpu() > node.cpuCapacity()) {
            return Optional.of("Insufficient CPU on node " + node.id() + ": need " + r.cpu()
                    + " of " + node.cpuCapacity());
        }
        if (node.memoryCapacityMb() > 0 && r.memoryMb() > node.memoryCapacityMb()) {
            return Optional.of("Insufficient memory on node " + node.id() + ": need " + r.memoryMb()
                    + "MB of " + node.memoryCapacityMb() + "MB");
        }
        if (node.diskCapacityMb() > 0 && r.diskMb() > node.diskCapacityMb()) {
            return Optional.of("Insufficient disk on node " + node.id() + ": need " + r.diskMb()
                    + "MB of " + node.diskCapacityMb() + "MB");
        }
        if (node.maxInstances() > 0 && after.instances() > node.maxInstances()) {
            return Optional.of("Instance limit reached on node " + node.id() + " (" + node.maxInstances() + ")");
        }
        if (node.maxContainers() > 0 && after.containers() > node.maxContainers()) {
            return Optional.of("Container limit reached on node " + node.id() + " (" + node.maxContainers() + ")");
        }
        if (node.maxVms() > 0 && after.vms() > node.maxVms()) {
            return Optional.of("VM limit reached on node " + node.id() + " (" + node.maxVms() + ")");
        }
        return Optional.empty();
    }

    private AdmissionRejectedException reject(RejectionReason reason, String message, AdmissionRequest request) {
        log.info("Rejected {} for user {} on node {} ({}): {}",
                request.kind().code(), request.userId(), request.nodeId(), reason, message);
        return new AdmissionRejectedException(reason, message);
    }
}
