package provisio.coordinator.store;

import provisio.coordinator.core.CoordinatorException;

/**
 * Persistence failure. The cause is the underlying SQLException.
 */
public class StoreException extends CoordinatorException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
