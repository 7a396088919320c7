package provisio.coordinator;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point: starts the dispatcher and background jobs and runs
 * until the process is stopped.
 *
 * Backend drivers are registered by the embedding control plane; started
 * this way, tasks for a backend without a driver fail with a driver error.
 */
public final class CoordinatorApp {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorApp.class);

    private CoordinatorApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down coordinator");
            deps.close();
            stopped.countDown();
        }, "provisio-shutdown"));

        deps.start();
        log.info("Coordinator running (drivers: {})", deps.driverRegistry().registeredKinds());
        stopped.await();
    }
}
