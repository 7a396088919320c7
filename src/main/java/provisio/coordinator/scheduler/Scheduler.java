package provisio.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Supervisor for background jobs:
 * - timeout sweep of RUNNING tasks
 * - expired reservation cleanup
 * - connection cache sweep
 * - health monitoring
 * - maintenance
 *
 * Each job is a {@link PeriodicWorker} with its own cancellation; a failing
 * job never stops the others.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final List<PeriodicWorker> workers = new CopyOnWriteArrayList<>();

    private volatile boolean running = false;

    public Scheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "provisio-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a job that runs at a fixed interval, first after one interval.
     */
    public PeriodicWorker every(String name, Duration interval, Runnable job) {
        return register(new PeriodicWorker(name, interval, interval, () -> {
            job.run();
            return interval;
        }));
    }

    /**
     * Register a job that chooses its own next delay.
     *
     * @param fallbackInterval delay used after a failed run
     */
    public PeriodicWorker adaptive(String name, Duration initialDelay, Duration fallbackInterval,
            PeriodicWorker.Body body) {
        return register(new PeriodicWorker(name, initialDelay, fallbackInterval, body));
    }

    private PeriodicWorker register(PeriodicWorker worker) {
        workers.add(worker);
        if (running) {
            worker.start(executor);
        }
        return worker;
    }

    /**
     * Start every registered job. Jobs registered later start immediately.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;
        for (PeriodicWorker worker : workers) {
            worker.start(executor);
        }
        log.info("Scheduler started with {} jobs", workers.size());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        workers.forEach(PeriodicWorker::cancel);
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public List<PeriodicWorker> workers() {
        return List.copyOf(workers);
    }
}
