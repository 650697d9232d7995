package adm.core.clock;

import java.util.concurrent.TimeUnit;

/**
 * Hand-driven clock for deterministic tests and benchmarks.
 * Reads are volatile so worker threads observe the value set by the test thread.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceSeconds(long seconds) {
        advanceNanos(TimeUnit.SECONDS.toNanos(seconds));
    }

    public void setNanos(long value) {
        now = value;
    }
}
