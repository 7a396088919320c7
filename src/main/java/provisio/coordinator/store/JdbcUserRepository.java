package provisio.coordinator.store;

import provisio.coordinator.model.UserAccount;
import provisio.coordinator.repository.UserRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC implementation of UserRepository.
 */
public class JdbcUserRepository implements UserRepository {

    private final Database db;

    public JdbcUserRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(UserAccount user) {
        String sql = """
                    MERGE INTO users (id, username, level)
                    KEY (id)
                    VALUES (?, ?, ?)
                """;

        db.withConnection("save user " + user.id(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, user.id());
                ps.setString(2, user.username());
                ps.setInt(3, user.level());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<UserAccount> findById(String userId) {
        return query("find user " + userId, "SELECT id, username, level FROM users WHERE id = ?", userId);
    }

    @Override
    public Optional<UserAccount> lockById(String userId) {
        return query("lock user " + userId, "SELECT id, username, level FROM users WHERE id = ? FOR UPDATE", userId);
    }

    private Optional<UserAccount> query(String action, String sql, String userId) {
        return db.withConnection(action, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(mapRow(rs));
                    }
                }
                return Optional.empty();
            }
        });
    }

    private UserAccount mapRow(ResultSet rs) throws SQLException {
        return new UserAccount(rs.getString("id"), rs.getString("username"), rs.getInt("level"));
    }
}
