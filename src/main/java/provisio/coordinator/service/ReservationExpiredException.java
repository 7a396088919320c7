package provisio.coordinator.service;

import provisio.coordinator.core.CoordinatorException;

public class ReservationExpiredException extends CoordinatorException {

    private final String sessionId;

    public ReservationExpiredException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
