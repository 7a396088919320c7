package provisio.coordinator.driver;

import provisio.coordinator.core.CoordinatorException;

/**
 * A backend call failed. The message is preserved on the failed task.
 */
public class DriverException extends CoordinatorException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
