package provisio.coordinator.scheduler;

import provisio.coordinator.driver.NodeConnectionCache;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.repository.TaskRepository;
import provisio.coordinator.service.ReservationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Periodic housekeeping: logs queue and cache sizes and purges finished
 * tasks older than the retention window.
 */
public class MaintenanceJob implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceJob.class);

    private final TaskRepository tasks;
    private final ReservationService reservations;
    private final NodeConnectionCache connections;
    private final Duration retention;
    private final Clock clock;

    public MaintenanceJob(TaskRepository tasks, ReservationService reservations, NodeConnectionCache connections,
            Duration retention, Clock clock) {
        this.tasks = tasks;
        this.reservations = reservations;
        this.connections = connections;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public void run() {
        Map<TaskStatus, Integer> counts = tasks.countByStatus();
        log.info("Tasks {}; cached connections {}; active reservations {}",
                counts, connections.size(), reservations.activeCount());
        purgeFinished();
    }

    /**
     * @return number of deleted tasks
     */
    public int purgeFinished() {
        Instant cutoff = clock.instant().minus(retention);
        int deleted = tasks.deleteTerminalBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} finished tasks older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
