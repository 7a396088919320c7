package provisio.coordinator.config;

import provisio.coordinator.model.AllocationMode;

import java.time.Duration;

/**
 * Configuration holder for coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/provisio;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    private int databasePoolSize = 10;

    // Admission / reservations
    private AllocationMode allocationMode = AllocationMode.HOLD;
    private Duration reservationTtl = Duration.ofHours(1);
    private Duration reservationCleanupBusyInterval = Duration.ofMinutes(10);
    private Duration reservationCleanupIdleInterval = Duration.ofHours(1);

    // Dispatch
    private Duration dispatchInterval = Duration.ofSeconds(5);
    private int dispatchBatchSize = 100;
    private int executorThreads = 8;
    private Duration timeoutSweepInterval = Duration.ofMinutes(1);
    private Duration maintenanceInterval = Duration.ofMinutes(10);
    private Duration taskRetention = Duration.ofDays(30);

    // Node connection cache
    private Duration connectionIdleTimeout = Duration.ofMinutes(30);
    private Duration connectionMaxLifetime = Duration.ofHours(2);
    private Duration connectionSweepInterval = Duration.ofMinutes(5);
    private Duration disconnectTimeout = Duration.ofSeconds(5);

    // Health monitor
    private Duration healthBusyInterval = Duration.ofMinutes(3);
    private Duration healthIdleInterval = Duration.ofMinutes(10);
    private int healthWorkers = 3;
    private Duration healthProbeTimeout = Duration.ofMinutes(2);
    private Duration probeConnectTimeout = Duration.ofSeconds(5);

    // Quota file (level.<n>.<key> = value), optional
    private String quotaFile = null;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("PROVISIO_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("PROVISIO_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String mode = System.getenv("PROVISIO_ALLOCATION_MODE");
        if (mode != null && !mode.isBlank()) {
            config.allocationMode = AllocationMode.valueOf(mode.trim().toUpperCase());
        }

        String ttl = System.getenv("PROVISIO_RESERVATION_TTL_SECONDS");
        if (ttl != null && !ttl.isBlank()) {
            config.reservationTtl = Duration.ofSeconds(Long.parseLong(ttl.trim()));
        }

        String executors = System.getenv("PROVISIO_EXECUTOR_THREADS");
        if (executors != null && !executors.isBlank()) {
            config.executorThreads = Integer.parseInt(executors.trim());
        }

        String healthWorkers = System.getenv("PROVISIO_HEALTH_WORKERS");
        if (healthWorkers != null && !healthWorkers.isBlank()) {
            config.healthWorkers = Integer.parseInt(healthWorkers.trim());
        }

        String retentionDays = System.getenv("PROVISIO_TASK_RETENTION_DAYS");
        if (retentionDays != null && !retentionDays.isBlank()) {
            config.taskRetention = Duration.ofDays(Long.parseLong(retentionDays.trim()));
        }

        String quotaFile = System.getenv("PROVISIO_QUOTA_FILE");
        if (quotaFile != null && !quotaFile.isBlank()) {
            config.quotaFile = quotaFile.trim();
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public AllocationMode allocationMode() {
        return allocationMode;
    }

    public Duration reservationTtl() {
        return reservationTtl;
    }

    public Duration reservationCleanupBusyInterval() {
        return reservationCleanupBusyInterval;
    }

    public Duration reservationCleanupIdleInterval() {
        return reservationCleanupIdleInterval;
    }

    public Duration dispatchInterval() {
        return dispatchInterval;
    }

    public int dispatchBatchSize() {
        return dispatchBatchSize;
    }

    public int executorThreads() {
        return executorThreads;
    }

    public Duration timeoutSweepInterval() {
        return timeoutSweepInterval;
    }

    public Duration maintenanceInterval() {
        return maintenanceInterval;
    }

    public Duration taskRetention() {
        return taskRetention;
    }

    public Duration connectionIdleTimeout() {
        return connectionIdleTimeout;
    }

    public Duration connectionMaxLifetime() {
        return connectionMaxLifetime;
    }

    public Duration connectionSweepInterval() {
        return connectionSweepInterval;
    }

    public Duration disconnectTimeout() {
        return disconnectTimeout;
    }

    public Duration healthBusyInterval() {
        return healthBusyInterval;
    }

    public Duration healthIdleInterval() {
        return healthIdleInterval;
    }

    public int healthWorkers() {
        return healthWorkers;
    }

    public Duration healthProbeTimeout() {
        return healthProbeTimeout;
    }

    public Duration probeConnectTimeout() {
        return probeConnectTimeout;
    }

    public String quotaFile() {
        return quotaFile;
    }

    public boolean hasQuotaFile() {
        return quotaFile != null && !quotaFile.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public CoordinatorConfig withAllocationMode(AllocationMode mode) {
        this.allocationMode = mode;
        return this;
    }

    public CoordinatorConfig withReservationTtl(Duration ttl) {
        this.reservationTtl = ttl;
        return this;
    }

    public CoordinatorConfig withDispatchInterval(Duration interval) {
        this.dispatchInterval = interval;
        return this;
    }

    public CoordinatorConfig withExecutorThreads(int threads) {
        this.executorThreads = threads;
        return this;
    }

    public CoordinatorConfig withTaskRetention(Duration retention) {
        this.taskRetention = retention;
        return this;
    }

    public CoordinatorConfig withConnectionIdleTimeout(Duration timeout) {
        this.connectionIdleTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withConnectionMaxLifetime(Duration lifetime) {
        this.connectionMaxLifetime = lifetime;
        return this;
    }

    public CoordinatorConfig withDisconnectTimeout(Duration timeout) {
        this.disconnectTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withHealthWorkers(int workers) {
        this.healthWorkers = workers;
        return this;
    }

    public CoordinatorConfig withHealthProbeTimeout(Duration timeout) {
        this.healthProbeTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withProbeConnectTimeout(Duration timeout) {
        this.probeConnectTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withQuotaFile(String path) {
        this.quotaFile = path;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", allocationMode=" + allocationMode +
                ", reservationTtl=" + reservationTtl +
                ", executorThreads=" + executorThreads +
                ", healthWorkers=" + healthWorkers +
                ", quotaFile=" + quotaFile +
                '}';
    }
}
