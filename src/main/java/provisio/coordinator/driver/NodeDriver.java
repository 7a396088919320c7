package provisio.coordinator.driver;

import provisio.coordinator.model.Task;

/**
 * Lifecycle operations against one backend node. One instance is bound to
 * one node's connection settings; instances are cached and reused by
 * {@link NodeConnectionCache}.
 *
 * <p>All operations are blocking and report failure by throwing
 * {@link DriverException}. The task carries the instance id and the opaque
 * payload the operation needs.
 */
public interface NodeDriver {

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * @return the backend name of the created instance, or null if the backend assigns none
     */
    String create(Task task, ProgressListener progress);

    void start(Task task, ProgressListener progress);

    void stop(Task task, ProgressListener progress);

    void restart(Task task, ProgressListener progress);

    void delete(Task task, ProgressListener progress);

    void reset(Task task, ProgressListener progress);

    void resetPassword(Task task, ProgressListener progress);
}
