package provisio.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A background job that reschedules itself after every run.
 *
 * <p>The body returns the delay before its next run, so a job can adapt its
 * own interval. An exception is logged and the job runs again after the
 * fallback interval. An {@link Error} stops this worker only.
 */
public final class PeriodicWorker {

    private static final Logger log = LoggerFactory.getLogger(PeriodicWorker.class);

    @FunctionalInterface
    public interface Body {
        /** @return delay before the next run, null for the fallback interval */
        Duration run() throws Exception;
    }

    private final String name;
    private final Body body;
    private final Duration initialDelay;
    private final Duration fallbackInterval;
    private final AtomicLong runs = new AtomicLong();

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> next;
    private volatile boolean cancelled;
    private volatile boolean failed;

    PeriodicWorker(String name, Duration initialDelay, Duration fallbackInterval, Body body) {
        this.name = name;
        this.body = body;
        this.initialDelay = initialDelay;
        this.fallbackInterval = fallbackInterval;
    }

    synchronized void start(ScheduledExecutorService executor) {
        this.executor = executor;
        scheduleNext(initialDelay);
    }

    private void runOnce() {
        if (cancelled) {
            return;
        }
        Duration delay = fallbackInterval;
        try {
            Duration requested = body.run();
            if (requested != null && !requested.isNegative()) {
                delay = requested;
            }
        } catch (Exception e) {
            log.error("{} failed, next attempt in {}ms", name, fallbackInterval.toMillis(), e);
        } catch (Error e) {
            failed = true;
            log.error("{} stopped after a fatal error", name, e);
            return;
        } finally {
            runs.incrementAndGet();
        }
        scheduleNext(delay);
    }

    private synchronized void scheduleNext(Duration delay) {
        if (cancelled || executor == null || executor.isShutdown()) {
            return;
        }
        try {
            next = executor.schedule(this::runOnce, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("{} not rescheduled, scheduler is shutting down", name);
        }
    }

    /** Stop this worker; a run already in progress finishes. */
    public synchronized void cancel() {
        cancelled = true;
        if (next != null) {
            next.cancel(false);
        }
    }

    public String name() {
        return name;
    }

    public long runs() {
        return runs.get();
    }

    public boolean isActive() {
        return !cancelled && !failed && executor != null;
    }
}
