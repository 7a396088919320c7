package provisio.coordinator.driver;

/**
 * Receives progress from a running driver operation.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int percent, String message);

    ProgressListener NONE = (percent, message) -> {
    };
}
