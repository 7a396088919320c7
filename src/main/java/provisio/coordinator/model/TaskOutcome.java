package provisio.coordinator.model;

/**
 * Result of a terminal transition requested on a task.
 */
public enum TaskOutcome {
    /** Transition applied */
    APPLIED,

    /** Task was already terminal - idempotent no-op */
    ALREADY_TERMINAL,

    /** Task exists but is not in a state the transition accepts */
    WRONG_STATE,

    /** CREATE could not consume its reservation and was failed instead */
    RESERVATION_EXPIRED
}
