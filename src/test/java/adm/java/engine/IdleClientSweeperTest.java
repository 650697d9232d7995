package adm.java.engine;

import adm.core.clock.ManualClock;
import adm.core.model.Tier;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IdleClientSweeperTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void testRunOnce_evictsIdleClientsAndLapsedBlocks() {
        ManualClock clock = new ManualClock(0L);
        AdmissionDecider decider = new AdmissionDecider(clock, AdmissionConfig.defaults());
        decider.decide("203.0.113.1", "/api/orders");
        decider.decide("203.0.113.2", "/api/ml/predict");
        decider.getBlockList().block("203.0.113.3", 30 * SECOND, 0);

        clock.setNanos(61 * SECOND);
        decider.decide("203.0.113.4", "/health");

        try (IdleClientSweeper sweeper = new IdleClientSweeper(decider, Duration.ofSeconds(30))) {
            sweeper.runOnce();
        }

        assertEquals(1, decider.getAccountant().trackedClients());
        assertEquals(0, decider.getBlockList().size());
        assertEquals(1, decider.getAccountant().countSince("203.0.113.4", Tier.HEALTH, 60 * SECOND, 61 * SECOND));
    }

    @Test
    void testRunOnce_failureIsContained() {
        AdmissionDecider decider = new AdmissionDecider(() -> {
            throw new IllegalStateException("clock unavailable");
        }, AdmissionConfig.defaults());

        try (IdleClientSweeper sweeper = new IdleClientSweeper(decider, Duration.ofSeconds(30))) {
            assertDoesNotThrow(sweeper::runOnce);
        }
    }

    @Test
    void testInvalidArguments() {
        AdmissionDecider decider = new AdmissionDecider(new ManualClock(0L), AdmissionConfig.defaults());

        assertThrows(IllegalArgumentException.class, () -> new IdleClientSweeper(null, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new IdleClientSweeper(decider, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new IdleClientSweeper(decider, null));
    }
}
