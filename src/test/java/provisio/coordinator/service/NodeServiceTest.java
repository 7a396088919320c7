package provisio.coordinator.service;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.driver.DriverRegistry;
import provisio.coordinator.driver.NodeConnectionCache;
import provisio.coordinator.driver.TransportRegistry;
import provisio.coordinator.model.BackendKind;
import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.LevelLimit;
import provisio.coordinator.model.Node;
import provisio.coordinator.model.Resources;
import provisio.coordinator.store.Database;
import provisio.coordinator.support.FakeNodeDriver;
import provisio.coordinator.support.Services;
import provisio.coordinator.support.TestDb;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeServiceTest {

    private static Database db;
    private Services s;
    private NodeConnectionCache cache;
    private NodeService nodeService;

    @BeforeAll
    static void setup() {
        db = TestDb.open("test-node-service");
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
        DriverRegistry drivers = new DriverRegistry().register(BackendKind.DOCKER, FakeNodeDriver::new);
        cache = new NodeConnectionCache(drivers, new TransportRegistry(), s.nodes, CoordinatorConfig.defaults(),
                s.clock);
        nodeService = new NodeService(s.nodes, s.reservations, cache, s.clock);
    }

    @AfterEach
    void closeCache() {
        cache.close();
    }

    @Test
    void registerFillsCreationTime() {
        Node node = nodeService.register(Node.builder()
                .id("edge-1")
                .kind(BackendKind.LXD)
                .host("10.0.0.5")
                .build());

        assertEquals(s.clock.instant(), node.createdAt());
        assertEquals(1, nodeService.findAll().size());
        assertEquals(BackendKind.LXD, nodeService.findById("edge-1").orElseThrow().kind());
        assertEquals("edge-1", nodeService.findById("edge-1").orElseThrow().name());
    }

    @Test
    void registerRequiresHost() {
        assertThrows(IllegalArgumentException.class,
                () -> nodeService.register(Node.builder().id("x").kind(BackendKind.DOCKER).build()));
    }

    @Test
    void administrationOfUnknownNodeFails() {
        assertThrows(NodeUnavailableException.class, () -> nodeService.freeze("missing"));
        assertThrows(NodeUnavailableException.class, () -> nodeService.remainingCapacity("missing"));
    }

    @Test
    void freezeExpiryAndPolicyAreStored() {
        nodeService.register(TestDb.node("n1").build());

        nodeService.freeze("n1");
        assertTrue(nodeService.findById("n1").orElseThrow().frozen());
        nodeService.unfreeze("n1");
        assertFalse(nodeService.findById("n1").orElseThrow().frozen());

        nodeService.setExpiry("n1", s.clock.instant().plus(Duration.ofDays(7)));
        assertEquals(s.clock.instant().plus(Duration.ofDays(7)), nodeService.findById("n1").orElseThrow().expiresAt());

        nodeService.updateConcurrencyPolicy("n1", true, 3);
        assertEquals(3, nodeService.findById("n1").orElseThrow().maxRunningTasks());
        assertThrows(IllegalArgumentException.class, () -> nodeService.updateConcurrencyPolicy("n1", true, 0));
    }

    @Test
    void connectionChangeDropsCachedHandle() {
        Node node = nodeService.register(TestDb.node("n1").build());
        cache.getOrCreate(node);
        assertTrue(cache.contains("n1"));

        nodeService.updateConnection("n1", "new-host.example.net", 2222, 0, "admin", "other-secret");

        assertFalse(cache.contains("n1"));
        assertEquals("new-host.example.net", nodeService.findById("n1").orElseThrow().host());
    }

    @Test
    void levelLimitsRoundTripThroughNodeRow() {
        nodeService.register(TestDb.node("n1").build());

        nodeService.setLevelLimits("n1", Map.of(2, new LevelLimit(1, 2, 512, 2048, 50)));

        String json = nodeService.findById("n1").orElseThrow().levelLimits();
        assertTrue(json.contains("max-instances"), json);

        nodeService.setLevelLimits("n1", Map.of());
        assertNull(nodeService.findById("n1").orElseThrow().levelLimits());
    }

    @Test
    void remainingCapacitySubtractsCommittedAndHeld() {
        nodeService.register(TestDb.node("n1").cpuCapacity(8).memoryCapacityMb(8192).maxInstances(4).build());
        s.nodes.commit("n1", InstanceKind.CONTAINER, Resources.of(2, 2048, 0));
        s.reservations.reserve("u1", "n1", null, InstanceKind.VM, Resources.of(1, 1024, 0), Duration.ofHours(1));

        NodeService.RemainingCapacity remaining = nodeService.remainingCapacity("n1");

        assertEquals(5, remaining.cpu());
        assertEquals(5120, remaining.memoryMb());
        assertEquals(-1, remaining.diskMb(), "disk is not limited");
        assertEquals(2, remaining.instances());
    }
}
