package provisio.coordinator.scheduler;

import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private Scheduler scheduler;

    @BeforeEach
    void setup() {
        scheduler = new Scheduler(2);
    }

    @AfterEach
    void teardown() {
        scheduler.close();
    }

    @Test
    void failingJobIsRescheduled() throws Exception {
        CountDownLatch attempts = new CountDownLatch(3);
        scheduler.every("flaky", Duration.ofMillis(10), () -> {
            attempts.countDown();
            throw new IllegalStateException("boom");
        });
        scheduler.start();

        assertTrue(attempts.await(5, TimeUnit.SECONDS));
    }

    @Test
    void fatalErrorStopsOnlyThatWorker() throws Exception {
        AtomicInteger fatalRuns = new AtomicInteger();
        CountDownLatch healthyRuns = new CountDownLatch(5);
        PeriodicWorker fatal = scheduler.every("fatal", Duration.ofMillis(10), () -> {
            fatalRuns.incrementAndGet();
            throw new AssertionError("fatal");
        });
        PeriodicWorker healthy = scheduler.every("healthy", Duration.ofMillis(10), healthyRuns::countDown);
        scheduler.start();

        assertTrue(healthyRuns.await(5, TimeUnit.SECONDS));
        assertEquals(1, fatalRuns.get());
        assertFalse(fatal.isActive());
        assertTrue(healthy.isActive());
    }

    @Test
    void adaptiveJobUsesReturnedDelay() throws Exception {
        CountDownLatch runs = new CountDownLatch(3);
        PeriodicWorker worker = scheduler.adaptive("adaptive", Duration.ZERO, Duration.ofHours(1), () -> {
            runs.countDown();
            return Duration.ofMillis(5);
        });
        scheduler.start();

        assertTrue(runs.await(5, TimeUnit.SECONDS));
        assertTrue(worker.runs() >= 3);
    }

    @Test
    void cancelledWorkerStopsRunning() throws Exception {
        CountDownLatch first = new CountDownLatch(1);
        AtomicInteger count = new AtomicInteger();
        PeriodicWorker worker = scheduler.every("once", Duration.ofMillis(10), () -> {
            count.incrementAndGet();
            first.countDown();
        });
        scheduler.start();
        assertTrue(first.await(5, TimeUnit.SECONDS));

        worker.cancel();
        Thread.sleep(50);
        int seen = count.get();
        Thread.sleep(100);

        assertEquals(seen, count.get());
        assertFalse(worker.isActive());
    }

    @Test
    void jobsRegisteredAfterStartRunImmediately() throws Exception {
        scheduler.start();
        CountDownLatch ran = new CountDownLatch(1);
        scheduler.adaptive("late", Duration.ZERO, Duration.ofSeconds(1), () -> {
            ran.countDown();
            return null;
        });

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertEquals(1, scheduler.workers().size());
    }
}
