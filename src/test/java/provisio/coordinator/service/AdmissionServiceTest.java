package provisio.coordinator.service;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.config.QuotaConfig;
import provisio.coordinator.core.CoordinatorException;
import provisio.coordinator.model.AllocationMode;
import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.RejectionReason;
import provisio.coordinator.model.Resources;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskKind;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.store.Database;
import provisio.coordinator.support.MutableClock;
import provisio.coordinator.support.Services;
import provisio.coordinator.support.TestDb;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionServiceTest {

    private static final Resources ONE_CPU = Resources.of(1, 256, 1024);

    private static Database db;
    private Services s;

    @BeforeAll
    static void setup() {
        db = TestDb.open("test-admission");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestDb.clean(db);
        s = Services.create(db);
    }

    private AdmissionRequest.Builder create(String userId, String nodeId, Resources footprint) {
        return AdmissionRequest.builder()
                .userId(userId)
                .nodeId(nodeId)
                .kind(TaskKind.CREATE)
                .instanceKind(InstanceKind.CONTAINER)
                .footprint(footprint);
    }

    private Task admitCreate(String userId, String nodeId, Resources footprint) {
        Task task = s.admission.admit(create(userId, nodeId, footprint).build());
        s.clock.advance(Duration.ofSeconds(1));
        return task;
    }

    private int taskCount() {
        return s.tasks.countByStatus().values().stream().mapToInt(Integer::intValue).sum();
    }

    @Test
    void admittedCreateIsPendingWithHold() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").cpuCapacity(4).build());

        Task task = admitCreate("u1", "n1", Resources.of(2, 1024, 4096));

        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals("Waiting to start", task.statusMessage());
        assertNotNull(task.sessionId());
        assertFalse(task.allocationCommitted());
        assertTrue(task.payload().contains(task.sessionId()));
        assertEquals(1800, task.timeoutSeconds());
        assertEquals(180, task.estimatedDurationSeconds());

        assertTrue(s.reservationRepo.findBySession(task.sessionId()).isPresent());
        assertEquals(0, s.nodes.findById("n1").orElseThrow().usedCpu(), "hold does not touch committed counters");
    }

    @Test
    void commitNowChargesNodeCountersImmediately() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").cpuCapacity(4).build());

        Task task = s.admission.admit(create("u1", "n1", Resources.of(2, 1024, 4096))
                .allocationMode(AllocationMode.COMMIT_NOW)
                .build());

        assertNull(task.sessionId());
        assertTrue(task.allocationCommitted());
        Node node = s.nodes.findById("n1").orElseThrow();
        assertEquals(2, node.usedCpu());
        assertEquals(1, node.containerCount());
        assertEquals(0, s.reservations.activeCount());
    }

    @Test
    void capacityCountsCommittedAndHeldResources() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").cpuCapacity(3).usedCpu(1).containerCount(1).build());

        admitCreate("u1", "n1", ONE_CPU);
        admitCreate("u1", "n1", ONE_CPU);

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
                () -> admitCreate("u1", "n1", ONE_CPU));
        assertEquals(RejectionReason.CAPACITY, e.reason());
        assertTrue(e.getMessage().contains("CPU"), e.getMessage());
    }

    @Test
    void instanceLimitsArePerKind() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").maxVms(1).build());

        s.admission.admit(create("u1", "n1", ONE_CPU).instanceKind(InstanceKind.VM).build());
        s.admission.admit(create("u1", "n1", ONE_CPU).instanceKind(InstanceKind.CONTAINER).build());

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
                () -> s.admission.admit(create("u1", "n1", ONE_CPU).instanceKind(InstanceKind.VM).build()));
        assertEquals(RejectionReason.CAPACITY, e.reason());
    }

    @Test
    void rejectionWritesNothing() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").cpuCapacity(1).build());

        assertThrows(AdmissionRejectedException.class, () -> admitCreate("u1", "n1", Resources.of(2, 0, 0)));

        assertEquals(0, taskCount());
        assertEquals(0, s.reservations.activeCount());
    }

    @Test
    void levelQuotaLimitsInstanceCount() {
        s.user("u1", 1); // level 1: one instance
        s.nodes.save(TestDb.node("n1").build());

        admitCreate("u1", "n1", Resources.of(1, 128, 512));

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
                () -> admitCreate("u1", "n1", Resources.of(1, 128, 512)));
        assertEquals(RejectionReason.QUOTA, e.reason());
    }

    @Test
    void quotaCountsExistingInstances() {
        s.user("u1", 1);
        s.nodes.save(TestDb.node("n1").build());
        Task first = admitCreate("u1", "n1", Resources.of(1, 128, 512));
        s.taskService.tryStart(first.id());
        s.taskService.completeTask(first.id(), "web-1");

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
                () -> admitCreate("u1", "n1", Resources.of(1, 128, 512)));
        assertEquals(RejectionReason.QUOTA, e.reason());
    }

    @Test
    void nodeOverrideTightensGlobalLevel() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").levelLimits("{\"5\":{\"max-instances\":1}}").build());

        admitCreate("u1", "n1", ONE_CPU);

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
                () -> admitCreate("u1", "n1", ONE_CPU));
        assertEquals(RejectionReason.QUOTA, e.reason());
    }

    @Test
    void malformedNodeOverrideIsIgnored() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").levelLimits("{not json").build());

        admitCreate("u1", "n1", ONE_CPU);
        admitCreate("u1", "n1", ONE_CPU);
    }

    @Test
    void levelWithoutQuotaIsRejected() {
        Services strict = new Services(db, CoordinatorConfig.defaults(), QuotaConfig.empty(),
                MutableClock.startingAt("2024-06-01T12:00:00Z"));
        strict.user("u1", 3);
        strict.nodes.save(TestDb.node("n1").build());

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
                () -> strict.admission.admit(create("u1", "n1", ONE_CPU).build()));
        assertEquals(RejectionReason.QUOTA, e.reason());
    }

    @Test
    void unknownUserIsRejected() {
        s.nodes.save(TestDb.node("n1").build());

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
                () -> admitCreate("ghost", "n1", ONE_CPU));
        assertEquals(RejectionReason.QUOTA, e.reason());
    }

    @Test
    void busyNodeStillQueuesNewTasks() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").build());
        Task running = admitCreate("u1", "n1", ONE_CPU);
        assertTrue(s.taskService.tryStart(running.id()).isPresent());

        Task queued = admitCreate("u1", "n1", ONE_CPU);

        assertEquals(TaskStatus.PENDING, queued.status());
        assertEquals(1, s.tasks.countRunningOnNode("n1"));
        assertTrue(s.taskService.tryStart(queued.id()).isEmpty());
    }

    @Test
    void pendingTasksDoNotCountAgainstConcurrency() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").build());

        admitCreate("u1", "n1", ONE_CPU);
        admitCreate("u1", "n1", ONE_CPU);

        assertEquals(2, s.tasks.findPendingByNode("n1").size());
    }

    @Test
    void nonCreateKindsSkipCapacityAndQuota() {
        s.user("u1", 1);
        s.nodes.save(TestDb.node("n1").cpuCapacity(1).usedCpu(1).containerCount(1).build());

        Task start = s.admission.admit(AdmissionRequest.builder()
                .userId("u1")
                .nodeId("n1")
                .instanceId("inst-1")
                .kind(TaskKind.START)
                .footprint(Resources.of(8, 0, 0))
                .build());

        assertEquals(Resources.NONE, start.footprint());
        assertNull(start.sessionId());
        assertEquals(300, start.timeoutSeconds());
    }

    @Test
    void unavailableNodesAreRejected() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("frozen").frozen(true).build());
        s.nodes.save(TestDb.node("expired").expiresAt(s.clock.instant().minusSeconds(1)).build());
        s.nodes.save(TestDb.node("unclaimable").allowClaim(false).build());
        s.nodes.save(TestDb.node("inactive").status(NodeStatus.INACTIVE).allowClaim(false).build());

        assertThrows(NodeUnavailableException.class, () -> admitCreate("u1", "missing", ONE_CPU));
        assertThrows(NodeUnavailableException.class, () -> admitCreate("u1", "frozen", ONE_CPU));
        assertThrows(NodeUnavailableException.class, () -> admitCreate("u1", "expired", ONE_CPU));
        assertThrows(NodeUnavailableException.class, () -> admitCreate("u1", "unclaimable", ONE_CPU));
        assertThrows(NodeUnavailableException.class, () -> admitCreate("u1", "inactive", ONE_CPU));
    }

    @Test
    void unclaimableNodeStillAcceptsLifecycleTasks() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").allowClaim(false).status(NodeStatus.PARTIAL).build());

        Task stop = s.admission.admit(AdmissionRequest.builder()
                .userId("u1").nodeId("n1").instanceId("inst-1").kind(TaskKind.STOP).build());

        assertEquals(TaskStatus.PENDING, stop.status());
    }

    @Test
    void deleteIsAcceptedOnInactiveNode() {
        s.user("u1", 5);
        s.nodes.save(TestDb.node("n1").status(NodeStatus.INACTIVE).allowClaim(false).build());

        Task delete = s.admission.admit(AdmissionRequest.builder()
                .userId("u1").nodeId("n1").instanceId("inst-1").kind(TaskKind.DELETE).build());
        assertEquals(TaskKind.DELETE, delete.kind());

        assertThrows(NodeUnavailableException.class, () -> s.admission.admit(AdmissionRequest.builder()
                .userId("u1").nodeId("n1").instanceId("inst-1").kind(TaskKind.RESTART).build()));
    }

    @Test
    void concurrentAdmissionNeverOvercommits() throws Exception {
        int capacity = 3;
        int contenders = 10;
        s.nodes.save(TestDb.node("n1").cpuCapacity(capacity).build());
        for (int i = 0; i < contenders; i++) {
            s.user("u" + i, 5);
        }

        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String userId = "u" + i;
                results.add(pool.submit(() -> {
                    go.await();
                    try {
                        s.admission.admit(create(userId, "n1", ONE_CPU).build());
                        return "ADMITTED";
                    } catch (AdmissionRejectedException e) {
                        return e.reason().name();
                    } catch (CoordinatorException e) {
                        return "ERROR";
                    }
                }));
            }
            go.countDown();

            int admitted = 0;
            int capacityRejections = 0;
            for (Future<String> f : results) {
                String outcome = f.get(60, TimeUnit.SECONDS);
                if (outcome.equals("ADMITTED")) {
                    admitted++;
                } else if (outcome.equals(RejectionReason.CAPACITY.name())) {
                    capacityRejections++;
                }
            }

            assertEquals(capacity, admitted);
            assertEquals(contenders - capacity, capacityRejections);
            assertEquals(capacity, s.reservations.activeCount());
        } finally {
            pool.shutdownNow();
        }
    }
}
