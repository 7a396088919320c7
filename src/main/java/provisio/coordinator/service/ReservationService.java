package provisio.coordinator.service;

import provisio.coordinator.model.InstanceKind;
import provisio.coordinator.model.Reservation;
import provisio.coordinator.model.Resources;
import provisio.coordinator.model.Usage;
import provisio.coordinator.repository.ReservationRepository;
import provisio.coordinator.repository.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Time-boxed holds on node capacity.
 *
 * <p>A reservation is resolved exactly once: either consumed by the
 * completing task (its footprint moves into committed counters in the same
 * transaction) or released. Expired reservations stop counting immediately
 * and are deleted later by the reaper.
 */
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final ReservationRepository repository;
    private final TxRunner tx;
    private final Clock clock;

    public ReservationService(ReservationRepository repository, TxRunner tx, Clock clock) {
        this.repository = repository;
        this.tx = tx;
        this.clock = clock;
    }

    /** Opaque session id: 16 random bytes, hex encoded. */
    public static String newSessionId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Insert a reservation. Joins the caller's transaction when there is one.
     *
     * @param sessionId blank or null generates a fresh session id
     */
    public Reservation reserve(String userId, String nodeId, String sessionId, InstanceKind kind,
            Resources footprint, Duration ttl) {
        Instant now = clock.instant();
        String session = sessionId == null || sessionId.isBlank() ? newSessionId() : sessionId;
        Reservation reservation = new Reservation(
                UUID.randomUUID().toString(),
                session,
                userId,
                nodeId,
                kind,
                footprint,
                now,
                now.plus(ttl));

        tx.required(() -> {
            repository.save(reservation);
            return null;
        });
        log.debug("Reserved {} on node {} for user {} (session {}, expires {})",
                footprint, nodeId, userId, session, reservation.expiresAt());
        return reservation;
    }

    /**
     * Consume a reservation. Must run inside the caller's transaction so the
     * deletion commits together with the caller's counter updates.
     *
     * @throws ReservationExpiredException if the reservation is absent, already
     *                                     consumed or past its expiry
     */
    public Reservation consumeBySession(String sessionId) {
        return tx.required(() -> {
            Optional<Reservation> found = repository.findBySession(sessionId);
            if (found.isEmpty()) {
                throw new ReservationExpiredException(sessionId,
                        "Reservation " + sessionId + " not found (expired or already resolved)");
            }
            Reservation reservation = found.get();
            if (reservation.isExpired(clock.instant())) {
                throw new ReservationExpiredException(sessionId,
                        "Reservation " + sessionId + " expired at " + reservation.expiresAt());
            }
            if (!repository.deleteBySession(sessionId)) {
                // consumed concurrently between the read and the delete
                throw new ReservationExpiredException(sessionId,
                        "Reservation " + sessionId + " was already consumed");
            }
            log.debug("Consumed reservation {}", sessionId);
            return reservation;
        });
    }

    /**
     * Release without committing.
     *
     * @return false when there was nothing to release
     */
    public boolean release(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }
        boolean deleted = tx.required(() -> repository.deleteBySession(sessionId));
        if (deleted) {
            log.debug("Released reservation {}", sessionId);
        } else {
            log.debug("Reservation {} already resolved", sessionId);
        }
        return deleted;
    }

    public List<Reservation> activeReservations() {
        return repository.findActive(clock.instant());
    }

    public int activeCount() {
        return repository.countActive(clock.instant());
    }

    public Usage sumActiveForNode(String nodeId) {
        return repository.sumActiveForNode(nodeId, clock.instant());
    }

    public Usage sumActiveForUser(String userId) {
        return repository.sumActiveForUser(userId, clock.instant());
    }

    /** Delete reservations past expiry. */
    public int purgeExpired() {
        int deleted = repository.deleteExpired(clock.instant());
        if (deleted > 0) {
            log.info("Purged {} expired reservations", deleted);
        }
        return deleted;
    }
}
