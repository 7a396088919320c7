package provisio.coordinator.model;

/**
 * Lifecycle operation a task performs against a node.
 */
public enum TaskKind {
    CREATE("create"),
    START("start"),
    STOP("stop"),
    RESTART("restart"),
    DELETE("delete"),
    RESET("reset"),
    RESET_PASSWORD("reset-password");

    private final String code;

    TaskKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Only instance creation consumes node capacity and user quota. */
    public boolean consumesResources() {
        return this == CREATE;
    }

    public static TaskKind fromCode(String code) {
        for (TaskKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code) || kind.name().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown task kind: " + code);
    }
}
