package provisio.coordinator.driver;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.model.BackendKind;
import provisio.coordinator.model.Node;
import provisio.coordinator.service.NodeUnavailableException;
import provisio.coordinator.store.Database;
import provisio.coordinator.store.JdbcNodeRepository;
import provisio.coordinator.support.FakeNodeDriver;
import provisio.coordinator.support.MutableClock;
import provisio.coordinator.support.TestDb;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NodeConnectionCacheTest {

    private static Database db;

    private JdbcNodeRepository nodes;
    private MutableClock clock;
    private TransportRegistry transports;
    private DriverRegistry drivers;
    private List<FakeNodeDriver> built;
    private volatile boolean failConnect;
    private volatile Duration disconnectDelay;
    private NodeConnectionCache cache;

    @BeforeAll
    static void setup() {
        db = TestDb.open("test-connections");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        TestDb.clean(db);
        nodes = new JdbcNodeRepository(db);
        clock = MutableClock.startingAt("2024-06-01T12:00:00Z");
        transports = new TransportRegistry();
        built = new CopyOnWriteArrayList<>();
        failConnect = false;
        disconnectDelay = Duration.ZERO;
        drivers = new DriverRegistry().register(BackendKind.DOCKER, (node, t) -> {
            FakeNodeDriver driver = new FakeNodeDriver(node, t).slowDisconnect(disconnectDelay);
            if (failConnect) {
                driver.failingToConnect();
            }
            built.add(driver);
            return driver;
        });
        cache = newCache(CoordinatorConfig.defaults()
                .withConnectionIdleTimeout(Duration.ofMinutes(5))
                .withConnectionMaxLifetime(Duration.ofMinutes(30))
                .withDisconnectTimeout(Duration.ofMillis(200)));
    }

    @AfterEach
    void close() {
        cache.close();
    }

    private NodeConnectionCache newCache(CoordinatorConfig config) {
        return new NodeConnectionCache(drivers, transports, nodes, config, clock);
    }

    @Test
    void reusesHandleWhileSettingsUnchanged() {
        Node node = TestDb.node("n1").build();

        NodeDriver first = cache.getOrCreate(node);
        clock.advance(Duration.ofMinutes(1));
        NodeDriver second = cache.getOrCreate(node);

        assertSame(first, second);
        assertEquals(1, built.size());
        assertEquals(1, built.get(0).connects.get());
    }

    @Test
    void changedConnectionSettingsRebuildHandle() {
        Node node = TestDb.node("n1").build();
        NodeDriver first = cache.getOrCreate(node);

        NodeDriver second = cache.getOrCreate(node.toBuilder().host("10.0.0.9").build());

        assertNotSame(first, second);
        assertEquals(1, built.get(0).disconnects.get());
        assertFalse(first.isConnected());
        assertEquals(1, transports.count("n1"));
    }

    @Test
    void droppedConnectionIsReplaced() {
        Node node = TestDb.node("n1").build();
        cache.getOrCreate(node);
        built.get(0).drop();

        cache.getOrCreate(node);

        assertEquals(2, built.size());
        assertTrue(built.get(1).isConnected());
    }

    @Test
    void sweepEvictsIdleHandles() {
        cache.getOrCreate(TestDb.node("n1").build());
        clock.advance(Duration.ofMinutes(4));
        assertEquals(0, cache.sweep());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(1, cache.sweep());
        assertFalse(cache.contains("n1"));
        assertEquals(0, transports.count("n1"));
    }

    @Test
    void busyHandleIsEvictedAfterMaxLifetime() {
        cache.close();
        cache = newCache(CoordinatorConfig.defaults()
                .withConnectionIdleTimeout(Duration.ofMinutes(5))
                .withConnectionMaxLifetime(Duration.ofSeconds(10))
                .withDisconnectTimeout(Duration.ofMillis(200)));
        Node node = TestDb.node("n1").build();
        cache.getOrCreate(node);

        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(1));
            cache.getOrCreate(node);
            assertEquals(0, cache.sweep());
        }
        clock.advance(Duration.ofSeconds(1));

        assertEquals(1, cache.sweep());
        assertEquals(1, built.size());
    }

    @Test
    void hungDisconnectStillClearsTransports() {
        disconnectDelay = Duration.ofSeconds(5);
        cache.getOrCreate(TestDb.node("n1").build());
        assertEquals(1, transports.count("n1"));

        long start = System.nanoTime();
        cache.invalidate("n1");
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 3000, "invalidate waited " + elapsedMs + "ms");
        assertEquals(0, transports.count("n1"));
        assertEquals(0, cache.size());
    }

    @Test
    void connectFailureClearsTransports() {
        failConnect = true;

        assertThrows(DriverException.class, () -> cache.getOrCreate(TestDb.node("n1").build()));

        assertEquals(0, transports.count("n1"));
        assertFalse(cache.contains("n1"));
    }

    @Test
    void unknownBackendKindIsDriverError() {
        Node lxd = TestDb.node("n1").kind(BackendKind.LXD).build();

        DriverException e = assertThrows(DriverException.class, () -> cache.getOrCreate(lxd));
        assertTrue(e.getMessage().contains("LXD"));
    }

    @Test
    void lookupByIdRequiresExistingNode() {
        assertThrows(NodeUnavailableException.class, () -> cache.getOrCreate("missing", "fp"));

        Node node = TestDb.node("n1").build();
        nodes.save(node);
        NodeDriver driver = cache.getOrCreate("n1", ConnectionFingerprint.of(node));
        assertSame(driver, cache.getOrCreate(node));
    }

    @Test
    void closeDisconnectsEverything() {
        cache.getOrCreate(TestDb.node("n1").build());
        cache.getOrCreate(TestDb.node("n2").build());

        cache.closeAll();

        assertEquals(0, cache.size());
        assertTrue(built.stream().allMatch(d -> d.disconnects.get() == 1));
    }
}
