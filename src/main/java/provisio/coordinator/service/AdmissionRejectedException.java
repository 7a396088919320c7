package provisio.coordinator.service;

import provisio.coordinator.core.CoordinatorException;
import provisio.coordinator.model.RejectionReason;

/**
 * Admission refused on quota, capacity or concurrency grounds. Nothing was persisted.
 */
public class AdmissionRejectedException extends CoordinatorException {

    private final RejectionReason reason;

    public AdmissionRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason reason() {
        return reason;
    }
}
