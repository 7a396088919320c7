package provisio.coordinator.repository;

import java.util.function.Supplier;

/**
 * Runs work inside a database transaction. Repository calls made by the body
 * on the same thread join that transaction.
 */
public interface TxRunner {

    /** Join the current transaction or start a new one. */
    <T> T required(Supplier<T> body);

    /** Always run in a fresh transaction, suspending any current one. */
    <T> T requiresNew(Supplier<T> body);

    default void inTransaction(Runnable body) {
        required(() -> {
            body.run();
            return null;
        });
    }
}
