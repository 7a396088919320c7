package provisio.coordinator.repository;

import provisio.coordinator.model.Reservation;
import provisio.coordinator.model.Usage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for capacity reservations.
 */
public interface ReservationRepository {

    void save(Reservation reservation);

    Optional<Reservation> findBySession(String sessionId);

    /** @return true if a row was deleted */
    boolean deleteBySession(String sessionId);

    /** Delete every reservation whose expiry is not after {@code now}. */
    int deleteExpired(Instant now);

    List<Reservation> findActive(Instant now);

    int countActive(Instant now);

    Usage sumActiveForNode(String nodeId, Instant now);

    Usage sumActiveForUser(String userId, Instant now);
}
