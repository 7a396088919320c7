package provisio.coordinator.store;

import provisio.coordinator.repository.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * JDBC implementation of TxRunner.
 * Binds the transaction's connection to the thread through {@link TxContext}
 * so repositories called by the body share it.
 */
public final class JdbcTxRunner implements TxRunner {

    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final Database db;

    public JdbcTxRunner(Database db) {
        this.db = db;
    }

    @Override
    public <T> T required(Supplier<T> body) {
        if (TxContext.get() != null) {
            // join the running transaction
            return body.get();
        }
        return runInNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Supplier<T> body) {
        Connection suspended = TxContext.get();
        try {
            return runInNewTransaction(body);
        } finally {
            if (suspended != null) {
                TxContext.set(suspended);
            }
        }
    }

    private <T> T runInNewTransaction(Supplier<T> body) {
        try (Connection c = db.getConnection()) {
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T result = body.get();
                c.commit();
                return result;
            } catch (RuntimeException | Error e) {
                safeRollback(c);
                throw e;
            } finally {
                TxContext.clear();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to run transaction", e);
        }
    }

    private static void safeRollback(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }
}
