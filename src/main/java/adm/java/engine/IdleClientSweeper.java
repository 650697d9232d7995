package adm.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically runs {@link AdmissionDecider#sweep()} on a single daemon thread,
 * so idle clients and lapsed blocks are released even if they never return.
 */
public final class IdleClientSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IdleClientSweeper.class);

    private final AdmissionDecider decider;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public IdleClientSweeper(AdmissionDecider decider, Duration interval) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.decider = decider;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "admission-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long periodMillis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::runOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Idle client sweeper started (every {}s)", interval.toSeconds());
    }

    /**
     * One sweep pass. Failures are logged and the schedule keeps running.
     */
    void runOnce() {
        try {
            decider.sweep();
        } catch (RuntimeException e) {
            log.error("Idle client sweep failed", e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
