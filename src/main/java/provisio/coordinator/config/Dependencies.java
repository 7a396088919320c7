package provisio.coordinator.config;

import provisio.coordinator.core.CoordinatorBus;
import provisio.coordinator.core.CoordinatorException;
import provisio.coordinator.driver.DriverRegistry;
import provisio.coordinator.driver.NodeConnectionCache;
import provisio.coordinator.driver.NodeDriverFactory;
import provisio.coordinator.driver.TaskExecutor;
import provisio.coordinator.driver.TransportRegistry;
import provisio.coordinator.health.HealthMonitor;
import provisio.coordinator.health.NodeProbe;
import provisio.coordinator.health.TcpReachabilityProbe;
import provisio.coordinator.model.BackendKind;
import provisio.coordinator.repository.InstanceRepository;
import provisio.coordinator.repository.NodeRepository;
import provisio.coordinator.repository.ReservationRepository;
import provisio.coordinator.repository.TaskRepository;
import provisio.coordinator.repository.TxRunner;
import provisio.coordinator.repository.UserRepository;
import provisio.coordinator.scheduler.MaintenanceJob;
import provisio.coordinator.scheduler.ReservationReaper;
import provisio.coordinator.scheduler.Scheduler;
import provisio.coordinator.scheduler.TaskDispatcher;
import provisio.coordinator.scheduler.TaskReaper;
import provisio.coordinator.service.AdmissionService;
import provisio.coordinator.service.NodeService;
import provisio.coordinator.service.QuotaService;
import provisio.coordinator.service.ReservationService;
import provisio.coordinator.service.TaskService;
import provisio.coordinator.store.Database;
import provisio.coordinator.store.JdbcInstanceRepository;
import provisio.coordinator.store.JdbcNodeRepository;
import provisio.coordinator.store.JdbcReservationRepository;
import provisio.coordinator.store.JdbcTaskRepository;
import provisio.coordinator.store.JdbcTxRunner;
import provisio.coordinator.store.JdbcUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.registerDriver(BackendKind.DOCKER, dockerFactory);
 * deps.start(); // dispatcher and background jobs
 * Task task = deps.taskService().createTask(request);
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final Database database;
    private final TxRunner tx;
    private final CoordinatorBus bus;

    private final UserRepository userRepository;
    private final NodeRepository nodeRepository;
    private final ReservationRepository reservationRepository;
    private final TaskRepository taskRepository;
    private final InstanceRepository instanceRepository;

    private final QuotaConfig quotaConfig;
    private final ReservationService reservationService;
    private final QuotaService quotaService;
    private final AdmissionService admissionService;
    private final TaskService taskService;
    private final NodeService nodeService;

    private final DriverRegistry driverRegistry;
    private final TransportRegistry transportRegistry;
    private final NodeConnectionCache connectionCache;
    private final TaskExecutor taskExecutor;
    private final TaskDispatcher dispatcher;
    private final HealthMonitor healthMonitor;
    private final Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, NodeProbe probe, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.tx = new JdbcTxRunner(database);
        this.bus = new CoordinatorBus();

        // Repositories
        this.userRepository = new JdbcUserRepository(database);
        this.nodeRepository = new JdbcNodeRepository(database);
        this.reservationRepository = new JdbcReservationRepository(database);
        this.taskRepository = new JdbcTaskRepository(database);
        this.instanceRepository = new JdbcInstanceRepository(database);

        // Drivers
        this.driverRegistry = new DriverRegistry();
        this.transportRegistry = new TransportRegistry();
        this.connectionCache = new NodeConnectionCache(driverRegistry, transportRegistry, nodeRepository,
                config, clock);

        // Services
        this.quotaConfig = loadQuota(config);
        this.reservationService = new ReservationService(reservationRepository, tx, clock);
        this.quotaService = new QuotaService(quotaConfig, instanceRepository, reservationRepository);
        this.admissionService = new AdmissionService(tx, userRepository, nodeRepository, taskRepository,
                reservationService, quotaService, config, clock);
        this.taskService = new TaskService(tx, taskRepository, nodeRepository, instanceRepository,
                reservationService, admissionService, bus, clock);
        this.nodeService = new NodeService(nodeRepository, reservationService, connectionCache, clock);

        // Dispatch
        this.taskExecutor = new TaskExecutor(nodeRepository, connectionCache, taskService,
                config.executorThreads());
        this.dispatcher = new TaskDispatcher(taskRepository, nodeRepository, taskService,
                taskExecutor::submit, config, clock);
        bus.onTasksChanged(dispatcher::triggerImmediateDrain);

        // Background jobs
        this.healthMonitor = new HealthMonitor(nodeRepository, probe, bus, config, clock);
        this.scheduler = new Scheduler(2);
        scheduler.every("task-timeout-sweep", config.timeoutSweepInterval(),
                new TaskReaper(taskRepository, taskService, clock));
        scheduler.adaptive("reservation-cleanup", config.reservationCleanupBusyInterval(),
                config.reservationCleanupBusyInterval(), new ReservationReaper(reservationService, config));
        scheduler.every("connection-sweep", config.connectionSweepInterval(), connectionCache::sweep);
        scheduler.adaptive("health-monitor", Duration.ZERO, config.healthBusyInterval(), healthMonitor::runOnce);
        scheduler.every("maintenance", config.maintenanceInterval(),
                new MaintenanceJob(taskRepository, reservationService, connectionCache,
                        config.taskRetention(), clock));

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, new TcpReachabilityProbe(config.probeConnectTimeout()), Clock.systemUTC());
    }

    /**
     * Create dependencies with a custom probe and clock.
     */
    public static Dependencies create(CoordinatorConfig config, NodeProbe probe, Clock clock) {
        return new Dependencies(config, probe, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    private static QuotaConfig loadQuota(CoordinatorConfig config) {
        if (!config.hasQuotaFile()) {
            return QuotaConfig.defaults();
        }
        Path path = Path.of(config.quotaFile());
        try {
            QuotaConfig quota = QuotaIniParser.parse(path);
            log.info("Loaded quota levels from {}: {}", path, quota);
            return quota;
        } catch (IOException e) {
            throw new CoordinatorException("Failed to read quota file " + path, e);
        }
    }

    /**
     * Register the driver factory for a backend kind.
     */
    public Dependencies registerDriver(BackendKind kind, NodeDriverFactory factory) {
        driverRegistry.register(kind, factory);
        return this;
    }

    /**
     * Start the dispatcher and the background jobs.
     */
    public void start() {
        dispatcher.start();
        scheduler.start();
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TxRunner tx() {
        return tx;
    }

    public CoordinatorBus bus() {
        return bus;
    }

    public UserRepository userRepository() {
        return userRepository;
    }

    public NodeRepository nodeRepository() {
        return nodeRepository;
    }

    public ReservationRepository reservationRepository() {
        return reservationRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public InstanceRepository instanceRepository() {
        return instanceRepository;
    }

    public QuotaConfig quotaConfig() {
        return quotaConfig;
    }

    public ReservationService reservationService() {
        return reservationService;
    }

    public QuotaService quotaService() {
        return quotaService;
    }

    public AdmissionService admissionService() {
        return admissionService;
    }

    public TaskService taskService() {
        return taskService;
    }

    public NodeService nodeService() {
        return nodeService;
    }

    public DriverRegistry driverRegistry() {
        return driverRegistry;
    }

    public TransportRegistry transportRegistry() {
        return transportRegistry;
    }

    public NodeConnectionCache connectionCache() {
        return connectionCache;
    }

    public TaskExecutor taskExecutor() {
        return taskExecutor;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        closeQuietly("scheduler", scheduler);
        closeQuietly("dispatcher", dispatcher);
        closeQuietly("task executor", taskExecutor);
        closeQuietly("health monitor", healthMonitor);
        closeQuietly("connection cache", connectionCache);
        closeQuietly("database", database);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String what, AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", what, e.getMessage());
        }
    }
}
