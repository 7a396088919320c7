package provisio.coordinator.support;

import provisio.coordinator.model.BackendKind;
import provisio.coordinator.model.Node;
import provisio.coordinator.store.Database;

import java.time.Instant;

/**
 * In-memory H2 databases and node fixtures for tests.
 */
public final class TestDb {

    private TestDb() {
    }

    public static String url(String name) {
        return "jdbc:h2:mem:" + name
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    }

    public static Database open(String name) {
        return new Database(url(name), 10);
    }

    public static void clean(Database db) throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            st.execute("DELETE FROM reservations");
            st.execute("DELETE FROM instances");
            st.execute("DELETE FROM nodes");
            st.execute("DELETE FROM users");
            conn.commit();
        }
    }

    /** Active, claimable Docker node with no capacity limits and one task slot. */
    public static Node.Builder node(String id) {
        return Node.builder()
                .id(id)
                .name("node " + id)
                .kind(BackendKind.DOCKER)
                .host(id + ".example.net")
                .username("root")
                .credential("secret")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"));
    }
}
