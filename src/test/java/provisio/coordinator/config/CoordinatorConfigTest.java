package provisio.coordinator.config;

import provisio.coordinator.model.AllocationMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(AllocationMode.HOLD, config.allocationMode());
        assertEquals(Duration.ofHours(1), config.reservationTtl());
        assertEquals(Duration.ofMinutes(30), config.connectionIdleTimeout());
        assertEquals(Duration.ofHours(2), config.connectionMaxLifetime());
        assertEquals(Duration.ofMinutes(3), config.healthBusyInterval());
        assertEquals(Duration.ofMinutes(10), config.healthIdleInterval());
        assertEquals(Duration.ofMinutes(2), config.healthProbeTimeout());
        assertFalse(config.hasQuotaFile());
    }

    @Test
    void fluentOverrides() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withAllocationMode(AllocationMode.COMMIT_NOW)
                .withReservationTtl(Duration.ofMinutes(5))
                .withExecutorThreads(2)
                .withQuotaFile("/etc/provisio/quota.ini");

        assertEquals(AllocationMode.COMMIT_NOW, config.allocationMode());
        assertEquals(Duration.ofMinutes(5), config.reservationTtl());
        assertEquals(2, config.executorThreads());
        assertTrue(config.hasQuotaFile());
        assertTrue(config.toString().contains("COMMIT_NOW"));
    }

    @Test
    void blankQuotaFileIsIgnored() {
        assertFalse(CoordinatorConfig.defaults().withQuotaFile("  ").hasQuotaFile());
    }
}
