package provisio.coordinator.core;

/**
 * Root of the coordinator's unchecked exception hierarchy.
 */
public class CoordinatorException extends RuntimeException {

    public CoordinatorException(String message) {
        super(message);
    }

    public CoordinatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
