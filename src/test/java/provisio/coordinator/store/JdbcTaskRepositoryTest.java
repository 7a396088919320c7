package provisio.coordinator.store;

import provisio.coordinator.model.Resources;
import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskKind;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.support.TestDb;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    private static Database db;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDb.open("test-tasks");
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        TestDb.clean(db);
    }

    private static Task.Builder task(String id, String nodeId, Instant createdAt) {
        return Task.builder()
                .id(id)
                .kind(TaskKind.CREATE)
                .userId("u1")
                .nodeId(nodeId)
                .createdAt(createdAt)
                .timeoutSeconds(1800);
    }

    @Test
    void saveAndFindById() {
        repo.save(task("task-1", "n1", T0)
                .payload("{\"instanceName\":\"web\"}")
                .footprint(Resources.of(2, 2048, 10240))
                .sessionId("abc")
                .build());

        Task found = repo.findById("task-1").orElseThrow();
        assertEquals(TaskKind.CREATE, found.kind());
        assertEquals(TaskStatus.PENDING, found.status());
        assertEquals("n1", found.nodeId());
        assertEquals(Resources.of(2, 2048, 10240), found.footprint());
        assertEquals("abc", found.sessionId());
        assertEquals(T0, found.createdAt());
    }

    @Test
    void pendingTasksAreReturnedOldestFirst() {
        repo.save(task("late", "n1", T0.plusSeconds(20)).build());
        repo.save(task("early", "n1", T0).build());
        repo.save(task("middle", "n2", T0.plusSeconds(10)).build());

        List<String> ids = repo.findPending(10).stream().map(Task::id).toList();
        assertEquals(List.of("early", "middle", "late"), ids);

        List<String> onNode = repo.findPendingByNode("n1").stream().map(Task::id).toList();
        assertEquals(List.of("early", "late"), onNode);
    }

    @Test
    void transitionsOnlyApplyFromTheExpectedState() {
        repo.save(task("t1", "n1", T0).build());

        assertFalse(repo.markCompleted("t1", null, T0), "pending task cannot complete");
        assertFalse(repo.markFailed("t1", "boom", T0), "pending task cannot fail");
        assertTrue(repo.markRunning("t1", T0.plusSeconds(1)));
        assertFalse(repo.markRunning("t1", T0.plusSeconds(2)), "already running");

        assertTrue(repo.updateProgress("t1", 40, "copying image"));
        assertTrue(repo.markCompleted("t1", "inst-1", T0.plusSeconds(30)));
        assertFalse(repo.markCancelled("t1", "too late", T0.plusSeconds(31)));

        Task done = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(100, done.progress());
        assertEquals("inst-1", done.instanceId());
        assertEquals(T0.plusSeconds(1), done.startedAt());
    }

    @Test
    void progressIsIgnoredUnlessRunning() {
        repo.save(task("t1", "n1", T0).build());
        assertFalse(repo.updateProgress("t1", 10, "x"));
    }

    @Test
    void runningCountIsDerivedFromTaskRows() {
        repo.save(task("a", "n1", T0).build());
        repo.save(task("b", "n1", T0.plusSeconds(1)).build());
        repo.save(task("c", "n2", T0.plusSeconds(2)).build());
        repo.markRunning("a", T0);
        repo.markRunning("c", T0);

        assertEquals(1, repo.countRunningOnNode("n1"));
        assertEquals(1, repo.countRunningOnNode("n2"));

        repo.markFailed("a", "driver error", T0.plusSeconds(5));
        assertEquals(0, repo.countRunningOnNode("n1"));
    }

    @Test
    void countByStatusCoversEveryStatus() {
        repo.save(task("a", "n1", T0).build());
        repo.save(task("b", "n1", T0).build());
        repo.markCancelled("b", "no longer needed", T0);

        Map<TaskStatus, Integer> counts = repo.countByStatus();
        assertEquals(1, counts.get(TaskStatus.PENDING));
        assertEquals(1, counts.get(TaskStatus.CANCELLED));
        assertEquals(0, counts.get(TaskStatus.RUNNING));
    }

    @Test
    void deleteTerminalBeforeKeepsRecentAndActiveTasks() {
        repo.save(task("old", "n1", T0).build());
        repo.save(task("recent", "n1", T0).build());
        repo.save(task("pending", "n1", T0).build());
        repo.markCancelled("old", "x", T0);
        repo.markCancelled("recent", "x", T0.plusSeconds(86400 * 40));

        int deleted = repo.deleteTerminalBefore(T0.plusSeconds(86400));

        assertEquals(1, deleted);
        assertTrue(repo.findById("old").isEmpty());
        assertTrue(repo.findById("recent").isPresent());
        assertTrue(repo.findById("pending").isPresent());
    }

    @Test
    void cancelRecordsReason() {
        repo.save(task("t1", "n1", T0).build());
        assertTrue(repo.markCancelled("t1", "Node is frozen", T0));

        Task cancelled = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.CANCELLED, cancelled.status());
        assertEquals("Node is frozen", cancelled.cancelReason());
        assertNotNull(cancelled.completedAt());
    }
}
