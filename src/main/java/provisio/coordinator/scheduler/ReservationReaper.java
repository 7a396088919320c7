package provisio.coordinator.scheduler;

import provisio.coordinator.config.CoordinatorConfig;
import provisio.coordinator.service.ReservationService;

import java.time.Duration;

/**
 * Deletes expired reservations. Runs often while reservations exist and
 * rarely when there are none.
 */
public class ReservationReaper implements PeriodicWorker.Body {

    private final ReservationService reservations;
    private final Duration busyInterval;
    private final Duration idleInterval;

    public ReservationReaper(ReservationService reservations, CoordinatorConfig config) {
        this.reservations = reservations;
        this.busyInterval = config.reservationCleanupBusyInterval();
        this.idleInterval = config.reservationCleanupIdleInterval();
    }

    @Override
    public Duration run() {
        reservations.purgeExpired();
        return reservations.activeCount() > 0 ? busyInterval : idleInterval;
    }
}
