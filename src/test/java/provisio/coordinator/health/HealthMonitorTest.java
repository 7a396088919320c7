package provisio.coordinator.health;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.core.CoordinatorBus;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.NodeStatus;
import provisio.coordinator.model.Reachability;
import provisio.coordinator.model.Resources;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskKind;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.service.AdmissionRequest;
import provisio.coordinator.store.Database;
import provisio.coordinator.support.Services;
import provisio.coordinator.support.TestDb;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    private static final ProbeResult UP = new ProbeResult(Reachability.ONLINE, Reachability.ONLINE);
    private static final ProbeResult HALF = new ProbeResult(Reachability.ONLINE, Reachability.OFFLINE);
    private static final ProbeResult DOWN = new ProbeResult(Reachability.OFFLINE, Reachability.OFFLINE);

    private static Database db;
    private Services s;
    private Map<String, NodeProbe> behaviour;
    private List<String> probed;
    private List<CoordinatorBus.NodeHealthChange> changes;
    private HealthMonitor monitor;

    @BeforeAll
    static void setup() {
        db = TestDb.open("test-health");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        TestDb.clean(db);
        s = Services.create(db);
        behaviour = new ConcurrentHashMap<>();
        probed = new CopyOnWriteArrayList<>();
        changes = new CopyOnWriteArrayList<>();
        s.bus.onNodeHealthChanged(changes::add);
        NodeProbe probe = node -> {
            probed.add(node.id());
            return behaviour.getOrDefault(node.id(), n -> UP).probe(node);
        };
        CoordinatorConfig config = s.config.withHealthProbeTimeout(Duration.ofMillis(300)).withHealthWorkers(4);
        monitor = new HealthMonitor(s.nodes, probe, s.bus, config, s.clock);
    }

    @AfterEach
    void stop() {
        monitor.close();
    }

    private Node save(String id, NodeStatus status, boolean allowClaim) {
        Node node = TestDb.node(id).apiPort(8443).status(status).allowClaim(allowClaim).build();
        s.nodes.save(node);
        return node;
    }

    private Node reload(String id) {
        return s.nodes.findById(id).orElseThrow();
    }

    @Test
    void unreachableNodeBecomesInactiveAndUnclaimable() {
        Node node = save("n1", NodeStatus.ACTIVE, true);
        behaviour.put("n1", n -> DOWN);

        assertTrue(monitor.check(node));

        Node after = reload("n1");
        assertEquals(NodeStatus.INACTIVE, after.status());
        assertFalse(after.allowClaim());
        assertEquals(Reachability.OFFLINE, after.sshStatus());
        assertEquals(s.clock.instant(), after.lastCheckedAt());
        assertEquals(1, changes.size());
        assertEquals(NodeStatus.ACTIVE, changes.get(0).previous());
        assertEquals(NodeStatus.INACTIVE, changes.get(0).current());
    }

    @Test
    void recoveryFromInactiveRestoresClaim() {
        Node node = save("n1", NodeStatus.INACTIVE, false);
        behaviour.put("n1", n -> HALF);

        monitor.check(node);

        Node after = reload("n1");
        assertEquals(NodeStatus.PARTIAL, after.status());
        assertTrue(after.allowClaim());
    }

    @Test
    void partialToActiveRestoresClaim() {
        Node node = save("n1", NodeStatus.PARTIAL, false);

        monitor.check(node);

        assertTrue(reload("n1").allowClaim());
        assertEquals(NodeStatus.ACTIVE, reload("n1").status());
    }

    @Test
    void degradingToPartialKeepsClaimSetting() {
        Node closed = save("n1", NodeStatus.ACTIVE, false);
        Node open = save("n2", NodeStatus.ACTIVE, true);
        behaviour.put("n1", n -> HALF);
        behaviour.put("n2", n -> HALF);

        monitor.check(closed);
        monitor.check(open);

        assertFalse(reload("n1").allowClaim());
        assertTrue(reload("n2").allowClaim());
    }

    @Test
    void statusChangeLeavesTasksAlone() {
        s.user("u1", 5);
        Node node = save("n1", NodeStatus.ACTIVE, true);
        Task task = s.taskService.createTask(AdmissionRequest.builder()
                .userId("u1")
                .nodeId("n1")
                .kind(TaskKind.CREATE)
                .footprint(Resources.of(1, 128, 512))
                .build());
        s.taskService.tryStart(task.id()).orElseThrow();
        behaviour.put("n1", n -> DOWN);

        monitor.check(node);

        assertEquals(TaskStatus.RUNNING, s.tasks.findById(task.id()).orElseThrow().status());
    }

    @Test
    void probeTimeoutOnlyStampsCheckTime() {
        Node node = save("n1", NodeStatus.ACTIVE, true);
        behaviour.put("n1", n -> {
            Thread.sleep(5_000);
            return DOWN;
        });

        assertFalse(monitor.check(node));

        Node after = reload("n1");
        assertEquals(NodeStatus.ACTIVE, after.status());
        assertTrue(after.allowClaim());
        assertEquals(s.clock.instant(), after.lastCheckedAt());
        assertTrue(changes.isEmpty());
    }

    @Test
    void probeErrorOnlyStampsCheckTime() {
        Node node = save("n1", NodeStatus.PARTIAL, true);
        behaviour.put("n1", n -> {
            throw new IllegalStateException("resolver down");
        });

        assertFalse(monitor.check(node));

        Node after = reload("n1");
        assertEquals(NodeStatus.PARTIAL, after.status());
        assertEquals(s.clock.instant(), after.lastCheckedAt());
    }

    @Test
    void stuckProbesDoNotPileUpThreads() {
        save("n1", NodeStatus.ACTIVE, true);
        save("n2", NodeStatus.ACTIVE, true);
        save("n3", NodeStatus.ACTIVE, true);
        CountDownLatch release = new CountDownLatch(1);
        Set<Thread> probeThreads = ConcurrentHashMap.newKeySet();
        NodeProbe stuck = node -> {
            probed.add(node.id());
            probeThreads.add(Thread.currentThread());
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException ignored) {
                    // keeps hanging like a blocking socket read
                }
            }
            return UP;
        };
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withHealthProbeTimeout(Duration.ofMillis(100))
                .withHealthWorkers(3);
        HealthMonitor stuckMonitor = new HealthMonitor(s.nodes, stuck, s.bus, config, s.clock);
        try {
            for (int round = 0; round < 5; round++) {
                stuckMonitor.runOnce();
                assertTrue(probeThreads.size() <= 3, "round " + round + " used " + probeThreads.size());
            }
            assertEquals(3, probed.size());
            assertEquals(Set.of("n1", "n2", "n3"), Set.copyOf(probed));
            assertEquals(NodeStatus.ACTIVE, reload("n1").status());
        } finally {
            release.countDown();
            stuckMonitor.close();
        }
    }

    @Test
    void roundSkipsFrozenAndExpiredNodes() {
        save("n1", NodeStatus.ACTIVE, true);
        s.nodes.save(TestDb.node("n2").frozen(true).build());
        s.nodes.save(TestDb.node("n3").expiresAt(s.clock.instant().minusSeconds(60)).build());

        Duration next = monitor.runOnce();

        assertEquals(List.of("n1"), probed);
        assertEquals(s.config.healthBusyInterval(), next);
    }

    @Test
    void idleRoundWaitsLonger() {
        assertEquals(s.config.healthIdleInterval(), monitor.runOnce());
        assertTrue(probed.isEmpty());
    }

    @Test
    void claimRules() {
        assertFalse(HealthMonitor.nextAllowClaim(NodeStatus.ACTIVE, NodeStatus.INACTIVE, true));
        assertTrue(HealthMonitor.nextAllowClaim(NodeStatus.INACTIVE, NodeStatus.ACTIVE, false));
        assertTrue(HealthMonitor.nextAllowClaim(NodeStatus.INACTIVE, NodeStatus.PARTIAL, false));
        assertTrue(HealthMonitor.nextAllowClaim(NodeStatus.PARTIAL, NodeStatus.ACTIVE, false));
        assertFalse(HealthMonitor.nextAllowClaim(NodeStatus.ACTIVE, NodeStatus.ACTIVE, false));
        assertTrue(HealthMonitor.nextAllowClaim(NodeStatus.ACTIVE, NodeStatus.PARTIAL, true));
    }
}
